package io.github.cyfko.contactql.jpa.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

/**
 * A URN through which a contact can be reached, e.g. {@code tel:+250788382011}.
 */
@Entity
@Table(name = "contact_urns")
public class ContactUrn {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "contact_id")
    private Contact contact;

    @Column(nullable = false, length = 128)
    private String scheme;

    @Column(nullable = false)
    private String path;

    public ContactUrn() {}

    public ContactUrn(Contact contact, String scheme, String path) {
        this.contact = contact;
        this.scheme = scheme;
        this.path = path;
    }

    public Long getId() {
        return id;
    }

    public Contact getContact() {
        return contact;
    }

    public void setContact(Contact contact) {
        this.contact = contact;
    }

    public String getScheme() {
        return scheme;
    }

    public void setScheme(String scheme) {
        this.scheme = scheme;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public String getIdentity() {
        return scheme + ":" + path;
    }
}
