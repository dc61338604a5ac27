package io.github.cyfko.contactql.jpa.model;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A contact of an organization.
 */
@Entity
@Table(name = "contacts")
public class Contact {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 36)
    private String uuid;

    @Column(name = "org_id", nullable = false)
    private Long orgId;

    private String name;

    @Column(length = 3)
    private String language;

    @Column(name = "created_on", nullable = false)
    private Instant createdOn;

    @OneToMany(mappedBy = "contact", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<ContactUrn> urns = new ArrayList<>();

    @OneToMany(mappedBy = "contact", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<ContactFieldValue> values = new ArrayList<>();

    public Contact() {}

    public Contact(String uuid, Long orgId, String name, Instant createdOn) {
        this.uuid = uuid;
        this.orgId = orgId;
        this.name = name;
        this.createdOn = createdOn;
    }

    public ContactUrn addUrn(String scheme, String path) {
        ContactUrn urn = new ContactUrn(this, scheme, path);
        urns.add(urn);
        return urn;
    }

    public ContactFieldValue addValue(ContactFieldValue value) {
        value.setContact(this);
        values.add(value);
        return value;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getUuid() {
        return uuid;
    }

    public void setUuid(String uuid) {
        this.uuid = uuid;
    }

    public Long getOrgId() {
        return orgId;
    }

    public void setOrgId(Long orgId) {
        this.orgId = orgId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }

    public Instant getCreatedOn() {
        return createdOn;
    }

    public void setCreatedOn(Instant createdOn) {
        this.createdOn = createdOn;
    }

    public List<ContactUrn> getUrns() {
        return urns;
    }

    public List<ContactFieldValue> getValues() {
        return values;
    }
}
