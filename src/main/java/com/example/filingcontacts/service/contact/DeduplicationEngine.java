package com.example.filingcontacts.service.contact;

import com.example.filingcontacts.dto.DedupCluster;
import com.example.filingcontacts.dto.DedupReport;
import com.example.filingcontacts.dto.DuplicateEntry;
import com.example.filingcontacts.model.Contact;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups contacts that describe the same party. Contacts are visited oldest first,
 * so the earliest record of each group is the one kept. The input list and its
 * contacts are never modified.
 */
@Component
public class DeduplicationEngine {

    static final double FUZZY_THRESHOLD = 0.9;

    public DedupReport deduplicate(List<Contact> contacts, DedupMode mode, boolean dryRun) {
        List<Contact> ordered = new ArrayList<>(contacts);
        ordered.sort(Comparator.comparing(Contact::getCreatedAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder())));

        DedupReport report = new DedupReport();
        report.setMode(mode);
        report.setDryRun(dryRun);
        report.setTotalContacts(ordered.size());

        Map<String, DedupCluster> clusters = new LinkedHashMap<>();
        if (mode == DedupMode.FUZZY) {
            fuzzyPass(ordered, report, clusters);
        } else {
            exactPass(ordered, mode, report, clusters);
        }
        report.setClusters(new ArrayList<>(clusters.values()));
        return report;
    }

    private void exactPass(List<Contact> ordered, DedupMode mode, DedupReport report, Map<String, DedupCluster> clusters) {
        Map<String, Contact> seen = new LinkedHashMap<>();
        for (Contact contact : ordered) {
            String key = matchKey(contact, mode);
            if (key == null) {
                report.getUnique().add(contact);
                continue;
            }
            Contact original = seen.get(key);
            if (original == null) {
                seen.put(key, contact);
                report.getUnique().add(contact);
                continue;
            }
            DuplicateEntry entry = new DuplicateEntry(contact.getId(), original.getId(), matchReason(mode), null, null);
            recordDuplicate(report, clusters, key, original, entry);
        }
    }

    private void fuzzyPass(List<Contact> ordered, DedupReport report, Map<String, DedupCluster> clusters) {
        List<FuzzyKey> seen = new ArrayList<>();
        for (Contact contact : ordered) {
            String person = personKey(contact);
            if (person.isEmpty()) {
                report.getUnique().add(contact);
                continue;
            }
            String company = normalize(contact.getCompany());

            FuzzyKey match = null;
            double nameScore = 0;
            double companyScore = 0;
            for (FuzzyKey candidate : seen) {
                nameScore = StringSimilarity.similarity(person, candidate.person);
                companyScore = company.isEmpty() || candidate.company.isEmpty()
                        ? 1.0
                        : StringSimilarity.similarity(company, candidate.company);
                if (nameScore >= FUZZY_THRESHOLD && companyScore >= FUZZY_THRESHOLD) {
                    match = candidate;
                    break;
                }
            }

            if (match == null) {
                seen.add(new FuzzyKey(person, company, contact));
                report.getUnique().add(contact);
                continue;
            }
            String reason = String.format("Fuzzy match (name: %d%%, company: %d%%)",
                    Math.round(nameScore * 100), Math.round(companyScore * 100));
            DuplicateEntry entry = new DuplicateEntry(contact.getId(), match.contact.getId(), reason, nameScore, companyScore);
            recordDuplicate(report, clusters, match.person + "|" + match.company, match.contact, entry);
        }
    }

    private void recordDuplicate(DedupReport report, Map<String, DedupCluster> clusters,
                                 String key, Contact original, DuplicateEntry entry) {
        report.getDuplicates().add(entry);
        clusters.computeIfAbsent(key, k -> new DedupCluster(k, original.getId(), new ArrayList<>()))
                .getDuplicates().add(entry);
    }

    /**
     * Exact-mode key, or null when the contact carries too little to be matched.
     */
    static String matchKey(Contact contact, DedupMode mode) {
        String person = personKey(contact);
        if (person.isEmpty()) {
            return null;
        }
        String company = normalize(contact.getCompany());
        switch (mode) {
            case NAME_ONLY:
                return person;
            case NAME_COMPANY:
                return person + "|" + company;
            case STRICT:
                String phone = normalize(contact.getPhone1()).replaceAll("\\D", "");
                String email = normalize(contact.getEmail1());
                if (company.isEmpty() && phone.isEmpty() && email.isEmpty()) {
                    return null;
                }
                return person + "|" + company + "|" + phone + "|" + email;
            default:
                throw new IllegalArgumentException("No exact key for mode " + mode);
        }
    }

    static String personKey(Contact contact) {
        String first = normalize(contact.getFirstName());
        String last = normalize(contact.getLastName());
        if (!first.isEmpty() && !last.isEmpty()) {
            return first + "::" + last;
        }
        return normalize(contact.getName());
    }

    private static String matchReason(DedupMode mode) {
        switch (mode) {
            case NAME_ONLY:
                return "Same first and last name";
            case NAME_COMPANY:
                return "Same name and company";
            default:
                return "Exact match on all fields";
        }
    }

    private static String normalize(String value) {
        return StringUtils.defaultString(value).trim().toLowerCase();
    }

    private static class FuzzyKey {
        final String person;
        final String company;
        final Contact contact;

        FuzzyKey(String person, String company, Contact contact) {
            this.person = person;
            this.company = company;
            this.contact = contact;
        }
    }
}
