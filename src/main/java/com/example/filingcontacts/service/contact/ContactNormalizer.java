package com.example.filingcontacts.service.contact;

import com.example.filingcontacts.dto.RawContact;
import com.example.filingcontacts.model.Contact;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Maps loosely-typed contacts from the language model onto the {@link Contact} schema.
 * Pure: no I/O, no clock.
 */
@Component
public class ContactNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(ContactNormalizer.class);

    static final int MAX_NAME_LENGTH = 255;
    static final int MAX_PHONE_LENGTH = 20;
    static final int MIN_PHONE_DIGITS = 7;

    private static final Pattern PHONE_DISALLOWED = Pattern.compile("[^\\d\\s\\-()+.]");
    private static final Pattern EMAIL_WRAPPING = Pattern.compile("^[\"'<\\[]+|[\"'>\\]]+$");
    private static final Pattern EMAIL_SHAPE = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern STATE_ZIP = Pattern.compile("([A-Z]{2})\\s+(\\d{5}(-\\d{4})?)");

    private static final Pattern FRACTION = Pattern.compile("^(\\d+(?:\\.\\d+)?)\\s*/\\s*(\\d+(?:\\.\\d+)?)$");
    private static final Pattern PERCENT = Pattern.compile("^(\\d+(?:\\.\\d+)?)\\s*%$");
    private static final Pattern DECIMAL = Pattern.compile("^\\d*\\.?\\d+$");
    private static final Pattern INTEREST_TOKEN =
            Pattern.compile("\\d+(?:\\.\\d+)?\\s*/\\s*\\d+(?:\\.\\d+)?|\\d+(?:\\.\\d+)?\\s*%");

    private static final Pattern ORRI = Pattern.compile("\\borri\\b|\\boverriding\\s+royalty", Pattern.CASE_INSENSITIVE);
    private static final Pattern UMI = Pattern.compile(
            "\\bumi\\b|\\bunleased\\b|\\buncommitted\\s+mineral", Pattern.CASE_INSENSITIVE);
    private static final Pattern WI = Pattern.compile("\\bwi\\b|\\bworking\\s+interest", Pattern.CASE_INSENSITIVE);

    static final List<String> LEGAL_INDICATORS = Arrays.asList(
            "attorney", "atty", "lawyer", "attorneys", "law firm", "law office", "esquire", "esq",
            "j.d.", "juris doctor", "p.c.", "p.a.", "llp", "pllc", "counsel", "counselor",
            "legal representative", "legal department", "legal services", "legal counsel",
            "law group", "law associates", "legal aid", "paralegal", "bar association",
            "legal clinic", "advocate");

    private static final List<Pattern> LEGAL_PATTERNS = LEGAL_INDICATORS.stream()
            .map(word -> Pattern.compile("(?<![a-z0-9])" + Pattern.quote(word) + "(?![a-z0-9])"))
            .collect(Collectors.toList());

    public List<Contact> normalizeAll(List<RawContact> rawContacts, String sourceFile, String jobId, String projectOrigin) {
        List<Contact> contacts = new ArrayList<>();
        for (RawContact raw : rawContacts) {
            Optional<Contact> contact = normalize(raw, sourceFile, jobId, projectOrigin);
            if (contact.isPresent()) {
                contacts.add(contact.get());
            } else {
                logger.debug("Dropped contact without name or company from {}", sourceFile);
            }
        }
        return contacts;
    }

    /**
     * @return the canonical contact, or empty when neither a name nor a company can be resolved
     */
    public Optional<Contact> normalize(RawContact raw, String sourceFile, String jobId, String projectOrigin) {
        if (raw == null) {
            return Optional.empty();
        }

        String company = truncate(clean(raw.getCompany()), MAX_NAME_LENGTH);
        String name = clean(raw.getName());
        String firstName = clean(raw.getFirstName());
        String lastName = clean(raw.getLastName());

        if (name != null && firstName == null && lastName == null) {
            String[] tokens = name.split("\\s+");
            if (tokens.length == 1) {
                firstName = tokens[0];
            } else if (tokens.length == 2) {
                firstName = tokens[0];
                lastName = tokens[1];
            } else {
                lastName = tokens[tokens.length - 1];
                firstName = String.join(" ", Arrays.copyOf(tokens, tokens.length - 1));
            }
        } else if (name == null && (firstName != null || lastName != null)) {
            name = StringUtils.joinWith(" ", StringUtils.defaultString(firstName), StringUtils.defaultString(lastName)).trim();
        }
        if (name == null) {
            name = company;
        }
        if (name == null) {
            return Optional.empty();
        }

        Contact contact = new Contact();
        contact.setName(truncate(name, MAX_NAME_LENGTH));
        contact.setCompany(company);
        contact.setFirstName(firstName);
        contact.setLastName(lastName);

        ParsedAddress parsed = parseAddress(clean(raw.getAddress()));
        contact.setAddress(parsed.street);
        contact.setCity(firstNonNull(clean(raw.getCity()), parsed.city));
        contact.setState(firstNonNull(clean(raw.getState()), parsed.state));
        contact.setZip(firstNonNull(clean(raw.getZip()), parsed.zip));
        contact.setUnit(clean(raw.getUnit()));

        contact.setPhones(collectPhones(raw));
        contact.setEmails(collectEmails(raw));

        String ownershipInfo = clean(raw.getOwnershipInfo());
        contact.setOwnershipInfo(ownershipInfo);
        Double percentage = parsePercentage(raw.getMineralRightsPercentage());
        if (percentage == null && ownershipInfo != null) {
            Matcher token = INTEREST_TOKEN.matcher(ownershipInfo);
            if (token.find()) {
                percentage = parsePercentage(token.group());
            }
        }
        contact.setMineralRightsPercentage(percentage);
        contact.setOwnershipType(resolveOwnershipType(raw.getOwnershipType(), raw.getInterestType(), ownershipInfo));

        contact.setNotes(clean(raw.getNotes()));
        contact.setRecordType(clean(raw.getRecordType()));
        contact.setDocumentSection(clean(raw.getDocumentSection()));
        contact.setLegalEntity(isLegalEntity(contact.getName(), contact.getCompany(), contact.getNotes()));

        contact.setSourceFile(sourceFile);
        contact.setJobId(jobId);
        contact.setProjectOrigin(projectOrigin);
        contact.setAcknowledged(false);
        return Optional.of(contact);
    }

    /**
     * Fractions ("3/8"), percentages ("25.5%") and decimal interests ("0.125") as a 0-100 percentage.
     * Anything unparseable or out of range is null.
     */
    public static Double parsePercentage(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return fromDecimal(((Number) value).doubleValue());
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }

        Matcher fraction = FRACTION.matcher(text);
        if (fraction.matches()) {
            double denominator = Double.parseDouble(fraction.group(2));
            if (denominator == 0) {
                return null;
            }
            return inRange(Double.parseDouble(fraction.group(1)) / denominator * 100);
        }
        Matcher percent = PERCENT.matcher(text);
        if (percent.matches()) {
            return inRange(Double.parseDouble(percent.group(1)));
        }
        if (DECIMAL.matcher(text).matches()) {
            return fromDecimal(Double.parseDouble(text));
        }
        return null;
    }

    private static Double fromDecimal(double value) {
        if (Double.isNaN(value) || value < 0) {
            return null;
        }
        return inRange(value < 1 ? value * 100 : value);
    }

    private static Double inRange(double percentage) {
        if (Double.isNaN(percentage) || percentage < 0 || percentage > 100) {
            return null;
        }
        return Math.round(percentage * 10000) / 10000.0;
    }

    static Contact.OwnershipType resolveOwnershipType(String... candidates) {
        for (String candidate : candidates) {
            if (StringUtils.isBlank(candidate)) {
                continue;
            }
            String text = candidate.trim();
            if (ORRI.matcher(text).find()) {
                return Contact.OwnershipType.ORRI;
            }
            if (UMI.matcher(text).find()) {
                return Contact.OwnershipType.UMI;
            }
            if (WI.matcher(text).find()) {
                return Contact.OwnershipType.WI;
            }
        }
        return null;
    }

    static boolean isLegalEntity(String... fields) {
        String text = Arrays.stream(fields)
                .filter(StringUtils::isNotBlank)
                .map(String::toLowerCase)
                .collect(Collectors.joining(" "));
        if (text.isEmpty()) {
            return false;
        }
        return LEGAL_PATTERNS.stream().anyMatch(p -> p.matcher(text).find());
    }

    private List<String> collectPhones(RawContact raw) {
        List<String> sources = new ArrayList<>();
        sources.add(raw.getPhone());
        sources.add(raw.getFax());
        if (raw.getPhones() != null) {
            sources.addAll(raw.getPhones());
        }
        Set<String> phones = new LinkedHashSet<>();
        for (String source : sources) {
            String phone = cleanPhone(source);
            if (phone != null) {
                phones.add(phone);
            }
        }
        return new ArrayList<>(phones).subList(0, Math.min(phones.size(), Contact.MAX_PHONES));
    }

    static String cleanPhone(String phone) {
        if (phone == null) {
            return null;
        }
        String cleaned = truncate(PHONE_DISALLOWED.matcher(phone).replaceAll("").trim(), MAX_PHONE_LENGTH);
        if (cleaned == null) {
            return null;
        }
        cleaned = cleaned.trim();
        return cleaned.replaceAll("\\D", "").length() >= MIN_PHONE_DIGITS ? cleaned : null;
    }

    private List<String> collectEmails(RawContact raw) {
        List<String> sources = new ArrayList<>();
        sources.add(raw.getEmail());
        if (raw.getEmails() != null) {
            sources.addAll(raw.getEmails());
        }
        Set<String> emails = new LinkedHashSet<>();
        for (String source : sources) {
            String email = validateEmail(source);
            if (email != null) {
                emails.add(email);
            }
        }
        return new ArrayList<>(emails).subList(0, Math.min(emails.size(), Contact.MAX_EMAILS));
    }

    static String validateEmail(String email) {
        if (email == null) {
            return null;
        }
        String cleaned = EMAIL_WRAPPING.matcher(email.trim().toLowerCase()).replaceAll("");
        if (cleaned.length() < 5 || cleaned.length() > 254) {
            return null;
        }
        if (!EMAIL_SHAPE.matcher(cleaned).matches()) {
            return null;
        }
        if (cleaned.contains("..") || cleaned.contains("@.") || cleaned.contains(".@")
                || cleaned.startsWith(".") || cleaned.endsWith(".")) {
            return null;
        }
        return cleaned;
    }

    static ParsedAddress parseAddress(String address) {
        ParsedAddress parsed = new ParsedAddress();
        if (address == null) {
            return parsed;
        }
        List<String> parts = Arrays.stream(address.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
        if (parts.isEmpty()) {
            return parsed;
        }
        parsed.street = parts.get(0);
        if (parts.size() == 2) {
            // "Dallas TX 75001": city, state and zip share the last segment
            String last = parts.get(1);
            Matcher stateZip = STATE_ZIP.matcher(last);
            if (stateZip.find()) {
                parsed.city = StringUtils.trimToNull(last.substring(0, stateZip.start()));
                parsed.state = stateZip.group(1);
                parsed.zip = stateZip.group(2);
            } else {
                parsed.city = last;
            }
        }
        if (parts.size() >= 3) {
            parsed.city = parts.get(1);
            String last = parts.get(parts.size() - 1);
            Matcher stateZip = STATE_ZIP.matcher(last);
            if (stateZip.find()) {
                parsed.state = stateZip.group(1);
                parsed.zip = stateZip.group(2);
            } else {
                parsed.state = last;
            }
        }
        return parsed;
    }

    private static String clean(String value) {
        return StringUtils.trimToNull(value);
    }

    private static String truncate(String value, int max) {
        return value == null ? null : StringUtils.truncate(value, max);
    }

    private static String firstNonNull(String preferred, String fallback) {
        return preferred != null ? preferred : fallback;
    }

    static class ParsedAddress {
        String street;
        String city;
        String state;
        String zip;
    }
}
