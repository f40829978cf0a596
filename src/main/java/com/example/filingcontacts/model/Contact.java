package com.example.filingcontacts.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "contacts", indexes = {
        @Index(name = "contacts_job_id_idx", columnList = "job_id"),
        @Index(name = "contacts_created_at_idx", columnList = "created_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Contact {

    public static final int MAX_PHONES = 8;
    public static final int MAX_EMAILS = 2;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name")
    private String name;

    @Column(name = "llc_owner")
    private String company;

    @Column(name = "first_name")
    private String firstName;

    @Column(name = "last_name")
    private String lastName;

    @Column(name = "address")
    private String address;

    @Column(name = "city")
    private String city;

    @Column(name = "state")
    private String state;

    @Column(name = "zip", length = 20)
    private String zip;

    @Column(name = "unit")
    private String unit;

    @Column(name = "phone1", length = 20)
    private String phone1;

    @Column(name = "phone2", length = 20)
    private String phone2;

    @Column(name = "phone3", length = 20)
    private String phone3;

    @Column(name = "phone4", length = 20)
    private String phone4;

    @Column(name = "phone5", length = 20)
    private String phone5;

    @Column(name = "phone6", length = 20)
    private String phone6;

    @Column(name = "phone7", length = 20)
    private String phone7;

    @Column(name = "phone8", length = 20)
    private String phone8;

    @Column(name = "email1")
    private String email1;

    @Column(name = "email2")
    private String email2;

    @Lob
    @Column(name = "notes")
    private String notes;

    @Lob
    @Column(name = "ownership_info")
    private String ownershipInfo;

    @Column(name = "mineral_rights_percentage")
    private Double mineralRightsPercentage;

    @Enumerated(EnumType.STRING)
    @Column(name = "ownership_type", length = 10)
    private OwnershipType ownershipType;

    @Column(name = "record_type")
    private String recordType;

    @Column(name = "document_section")
    private String documentSection;

    @Column(name = "source_file")
    private String sourceFile;

    @Column(name = "job_id", length = 100)
    private String jobId;

    @Column(name = "project_origin", length = 50)
    private String projectOrigin;

    @Column(name = "islegal", nullable = false)
    private boolean legalEntity = false;

    @Column(name = "acknowledged", nullable = false)
    private boolean acknowledged = false;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    /**
     * Fills phone1..phone8 in order; extra numbers are dropped.
     */
    public void setPhones(List<String> phones) {
        String[] slots = new String[MAX_PHONES];
        for (int i = 0; i < Math.min(phones.size(), MAX_PHONES); i++) {
            slots[i] = phones.get(i);
        }
        phone1 = slots[0];
        phone2 = slots[1];
        phone3 = slots[2];
        phone4 = slots[3];
        phone5 = slots[4];
        phone6 = slots[5];
        phone7 = slots[6];
        phone8 = slots[7];
    }

    public List<String> getPhones() {
        List<String> phones = new ArrayList<>();
        for (String phone : new String[]{phone1, phone2, phone3, phone4, phone5, phone6, phone7, phone8}) {
            if (phone != null) {
                phones.add(phone);
            }
        }
        return phones;
    }

    public void setEmails(List<String> emails) {
        email1 = emails.size() > 0 ? emails.get(0) : null;
        email2 = emails.size() > 1 ? emails.get(1) : null;
    }

    public enum OwnershipType {
        WI,
        ORRI,
        UMI
    }
}
