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

import java.math.BigDecimal;
import java.time.Instant;

/**
 * The value of a custom field for a contact.
 * <p>
 * The raw text is always kept in {@code stringValue}; the typed columns are only filled when the
 * text converts to the field's type, so a decimal field set to {@code "X"} has a string value but
 * no decimal value.
 * </p>
 */
@Entity
@Table(name = "contact_field_values")
public class ContactFieldValue {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "contact_id")
    private Contact contact;

    @Column(name = "field_key", nullable = false, length = 36)
    private String fieldKey;

    @Column(name = "string_value", length = 640)
    private String stringValue;

    @Column(name = "decimal_value", precision = 36, scale = 8)
    private BigDecimal decimalValue;

    @Column(name = "datetime_value")
    private Instant datetimeValue;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "location_value_id")
    private AdminBoundary locationValue;

    public ContactFieldValue() {}

    public ContactFieldValue(String fieldKey, String stringValue) {
        this.fieldKey = fieldKey;
        this.stringValue = stringValue;
    }

    public static ContactFieldValue text(String fieldKey, String value) {
        return new ContactFieldValue(fieldKey, value);
    }

    public static ContactFieldValue decimal(String fieldKey, String raw, BigDecimal value) {
        ContactFieldValue fieldValue = new ContactFieldValue(fieldKey, raw);
        fieldValue.decimalValue = value;
        return fieldValue;
    }

    public static ContactFieldValue datetime(String fieldKey, String raw, Instant value) {
        ContactFieldValue fieldValue = new ContactFieldValue(fieldKey, raw);
        fieldValue.datetimeValue = value;
        return fieldValue;
    }

    public static ContactFieldValue location(String fieldKey, AdminBoundary boundary) {
        ContactFieldValue fieldValue = new ContactFieldValue(fieldKey, boundary.getName());
        fieldValue.locationValue = boundary;
        return fieldValue;
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

    public String getFieldKey() {
        return fieldKey;
    }

    public String getStringValue() {
        return stringValue;
    }

    public void setStringValue(String stringValue) {
        this.stringValue = stringValue;
    }

    public BigDecimal getDecimalValue() {
        return decimalValue;
    }

    public void setDecimalValue(BigDecimal decimalValue) {
        this.decimalValue = decimalValue;
    }

    public Instant getDatetimeValue() {
        return datetimeValue;
    }

    public void setDatetimeValue(Instant datetimeValue) {
        this.datetimeValue = datetimeValue;
    }

    public AdminBoundary getLocationValue() {
        return locationValue;
    }

    public void setLocationValue(AdminBoundary locationValue) {
        this.locationValue = locationValue;
    }
}
