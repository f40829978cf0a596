package com.example.filingcontacts.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DedupCluster {
    private String matchKey;
    private Long canonicalId;
    private List<DuplicateEntry> duplicates = new ArrayList<>();

    public int size() {
        return duplicates.size() + 1;
    }
}
