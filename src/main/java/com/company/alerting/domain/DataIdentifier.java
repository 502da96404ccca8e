package com.company.alerting.domain;

import com.company.alerting.domain.enums.IdentifierAction;
import lombok.Value;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Sensitive-data pattern applied to free-text fields.
 */
@Value
public class DataIdentifier {

    private static final Map<String, String> BUILT_IN_PATTERNS = Map.of(
            "Ssn", "\\b\\d{3}-\\d{2}-\\d{4}\\b",
            "DriversLicenseUs", "\\b[A-Z]\\d{7,12}\\b",
            "EmailAddress", "\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b",
            "CreditCardNumber", "\\b(?:\\d{4}[ -]?){3}\\d{4}\\b",
            "AwsSecretAccessKey", "(?<![A-Za-z0-9/+])[A-Za-z0-9/+]{40}(?![A-Za-z0-9/+])"
    );

    String name;
    Pattern pattern;
    IdentifierAction action;

    /**
     * Resolves a configured identifier. An explicit pattern wins over the built-in one.
     */
    public static DataIdentifier of(String name, String pattern, IdentifierAction action) {
        String regex = pattern != null && !pattern.isBlank() ? pattern : BUILT_IN_PATTERNS.get(name);
        if (regex == null) {
            throw new IllegalArgumentException("No pattern configured for data identifier " + name);
        }
        return new DataIdentifier(name, Pattern.compile(regex), action);
    }
}
