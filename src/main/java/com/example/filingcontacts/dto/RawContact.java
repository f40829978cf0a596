package com.example.filingcontacts.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Contact object as the language model returns it. Every field is optional and
 * loosely typed; {@link com.example.filingcontacts.service.contact.ContactNormalizer}
 * turns it into a {@code Contact}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawContact {
    private String company;
    private String name;

    @JsonProperty("first_name")
    private String firstName;

    @JsonProperty("last_name")
    private String lastName;

    private String address;
    private String city;
    private String state;
    private String zip;
    private String unit;
    private String phone;
    private String fax;
    private List<String> phones = new ArrayList<>();
    private String email;
    private List<String> emails = new ArrayList<>();

    @JsonProperty("ownership_info")
    private String ownershipInfo;

    @JsonProperty("interest_type")
    private String interestType;

    @JsonProperty("ownership_type")
    private String ownershipType;

    // numbers, fractions ("3/8") and percentages ("25.5%") all show up here
    @JsonProperty("mineral_rights_percentage")
    private Object mineralRightsPercentage;

    private String notes;

    @JsonProperty("record_type")
    private String recordType;

    @JsonProperty("document_section")
    private String documentSection;
}
