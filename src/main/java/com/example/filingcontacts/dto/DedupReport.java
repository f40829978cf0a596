package com.example.filingcontacts.dto;

import com.example.filingcontacts.model.Contact;
import com.example.filingcontacts.service.contact.DedupMode;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Data
@NoArgsConstructor
public class DedupReport {
    private DedupMode mode;
    private boolean dryRun;
    private int totalContacts;
    private List<Contact> unique = new ArrayList<>();
    private List<DuplicateEntry> duplicates = new ArrayList<>();
    private List<DedupCluster> clusters = new ArrayList<>();
    private int deletedCount;

    public List<Long> getDuplicateIds() {
        return duplicates.stream().map(DuplicateEntry::getId).collect(Collectors.toList());
    }
}
