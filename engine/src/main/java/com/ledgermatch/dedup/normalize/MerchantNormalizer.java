package com.ledgermatch.dedup.normalize;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reduces a raw bank/feed description to a canonical merchant token, e.g.
 * "AplPay CHIPOTLE 1249GAINESVILLE VA" -> "CHIPOTLE", "Chipotle Mexican Grill" -> "CHIPOTLE MEXICAN GRILL".
 * Acronyms are not expanded (AWS stays AWS); the semantic verifier handles brand knowledge.
 * <p>
 * Idempotent: normalizing an already normalized value returns it unchanged.
 */
@Component
public class MerchantNormalizer {

    /** Wallet, POS and processor prefixes. Entries ending in a letter or digit only match as whole words. */
    static final List<String> PREFIXES = List.of(
            "APLPAY", "APPLE PAY", "APL*PAY", "APPLEPAY",
            "SQ *", "SQ*", "SQUARE *", "GOSQ.COM",
            "TST*", "TST *", "TOAST*",
            "SP ", "SP*", "STRIPE*", "SHOPIFY*",
            "PAYPAL *", "PAYPAL*", "PP*", "VENMO *", "VENMO*",
            "POS PURCHASE", "POS DEBIT", "PURCHASE", "POS",
            "DEBIT CARD", "DEBIT", "CHECKCARD", "CHECK CARD",
            "ACH DEBIT", "ACH CREDIT", "ACH",
            "ELECTRONIC", "RECURRING", "AUTOPAY PAYMENT", "AUTOPAY", "AUTO PAY", "BILL PAY",
            "ONLINE", "INTERNET", "MOBILE PAYMENT", "MOBILE", "CONTACTLESS", "PAYMENT",
            "AMZ*", "AMZN*", "AMAZON*",
            "GOOGLE*", "GOOGLE *", "GOOG*",
            "UBER *", "UBER*", "LYFT *", "LYFT*",
            "DD *", "DOORDASH*", "GRUBHUB*", "GH*", "INSTACART*",
            "CKE*", "CHK*", "WWW.", "HTTP://", "HTTPS://",
            "BT*", "FH*", "CL*", "CS *", "DNH*", "WWP*",
            "INTL", "FOREIGN",
            "AMEX RESY CREDIT", "AMEX DINING CREDIT", "MEM RWDS", "GLOBALREWARDS"
    );

    /** Trailing confirmation, ACH class, card network and legal-form words. Matched as whole words. */
    static final List<String> SUFFIXES = List.of(
            "- THANK YOU", "THANK YOU", "PAYMENT RECEIVED", "APPROVED",
            "PAYROLL", "DIR DEP", "DIRECT DEP", "DIRECT DEPOSIT", "PPD", "WEB", "TEL", "CCD",
            "VISA", "MASTERCARD", "MC", "AMEX", "DISCOVER",
            "INC.", "INC", "LLC.", "LLC", "CORP.", "CORP", "CO.", "CO", "LTD.", "LTD"
    );

    static final List<String> US_STATES = List.of(
            "AL", "AK", "AZ", "AR", "CA", "CO", "CT", "DE", "FL", "GA", "HI", "ID", "IL", "IN", "IA",
            "KS", "KY", "LA", "ME", "MD", "MA", "MI", "MN", "MS", "MO", "MT", "NE", "NV", "NH", "NJ",
            "NM", "NY", "NC", "ND", "OH", "OK", "OR", "PA", "RI", "SC", "SD", "TN", "TX", "UT", "VT",
            "VA", "WA", "WV", "WI", "WY", "DC"
    );

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "a", "an", "of", "and", "or", "in", "at", "to", "for", "on", "by");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TRAILING_CITY_STATE = Pattern.compile(
            "\\s+(?:[A-Z]+\\s+)?(?:" + String.join("|", US_STATES) + ")\\s*$");
    private static final Pattern MASKED_CARD = Pattern.compile(
            "\\s*(?:\\b(?:CARD|ACCT)\\s+)?(?:X{2,}|\\*+)\\d{4}\\b");
    private static final Pattern TRAILING_LONG_NUMBER_AND_REST = Pattern.compile("\\s+\\d{3,}.*$");
    private static final Pattern TRAILING_SHORT_NUMBER = Pattern.compile("\\s+#?\\d+\\s*$");
    private static final Pattern TRAILING_ZIP = Pattern.compile("\\s+\\d{5}(?:-\\d{4})?\\s*$");
    private static final Pattern TRAILING_PHONE = Pattern.compile(
            "\\s+(?:\\(\\d{3}\\)\\s*\\d{3}-\\d{4}|\\d{3}-\\d{3}-\\d{4})\\s*$");
    private static final Pattern TRAILING_REFERENCE = Pattern.compile("\\s+(?:[A-Z]{2,3}\\d{5,}|ID:\\s*\\S+)\\s*$");
    private static final Pattern TRAILING_DOMAIN_WORD = Pattern.compile("\\s+\\S+\\.(?:COM|NET|ORG|IO|CO)\\S*\\s*$");
    private static final Pattern DOMAIN_TLD = Pattern.compile("(?<=[A-Z0-9])\\.(?:COM|NET|ORG|IO)(?:/\\S*)?$");
    private static final Pattern TRAILING_ACCOUNT_NUMBER = Pattern.compile("\\s+-\\d+\\s*$");
    private static final Pattern SEPARATORS = Pattern.compile("[*#/]+");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[-,.:;]+$");
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]");

    private static final int MAX_WORDS = 4;
    private static final int MIN_TOKEN_LENGTH = 3;

    /**
     * Canonical merchant token: upper case, single spaces, processor and location noise removed.
     * Null or blank input yields "".
     */
    public String normalize(String description) {
        if (description == null || description.isBlank()) {
            return "";
        }
        String current = WHITESPACE.matcher(description.toUpperCase(Locale.ROOT).strip()).replaceAll(" ");
        // every pass only shortens the text, so this terminates
        while (true) {
            String next = singlePass(current);
            if (next.equals(current)) {
                return current;
            }
            current = next;
        }
    }

    /**
     * Lower-case words of at least three alphanumeric characters, stop words removed, in order of appearance.
     */
    public List<String> meaningfulTokens(String description) {
        String normalized = normalize(description).toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return List.of();
        }
        Set<String> tokens = new LinkedHashSet<>();
        for (String word : WHITESPACE.split(normalized)) {
            if (word.length() < MIN_TOKEN_LENGTH || STOP_WORDS.contains(word)) {
                continue;
            }
            String cleaned = NON_ALNUM.matcher(word).replaceAll("");
            if (cleaned.length() >= MIN_TOKEN_LENGTH) {
                tokens.add(cleaned);
            }
        }
        return new ArrayList<>(tokens);
    }

    /**
     * True when two raw descriptions share a majority of their meaningful tokens (or at least two).
     * Tokens of four or more characters also count when one contains the other, e.g. "mcdonalds" / "mcdonald".
     */
    public boolean hasSignificantTokenOverlap(String first, String second) {
        List<String> tokens1 = meaningfulTokens(first);
        List<String> tokens2 = meaningfulTokens(second);
        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return false;
        }
        int overlap = 0;
        for (String t1 : tokens1) {
            if (tokens2.contains(t1)) {
                overlap++;
            }
        }
        for (String t1 : tokens1) {
            for (String t2 : tokens2) {
                if (t1.length() >= 4 && t2.length() >= 4 && !t1.equals(t2)
                        && (t1.contains(t2) || t2.contains(t1))) {
                    overlap++;
                }
            }
        }
        int minTokens = Math.min(tokens1.size(), tokens2.size());
        return overlap >= 1 && (overlap >= minTokens * 0.5 || overlap >= 2);
    }

    private String singlePass(String input) {
        String clean = stripPrefixes(input);
        clean = stripSuffixes(clean);
        clean = removeKeepingContent(clean, MASKED_CARD);
        clean = removeKeepingContent(clean, TRAILING_CITY_STATE);
        clean = removeKeepingContent(clean, TRAILING_LONG_NUMBER_AND_REST);
        clean = removeKeepingContent(clean, TRAILING_SHORT_NUMBER);
        clean = removeKeepingContent(clean, TRAILING_ZIP);
        clean = removeKeepingContent(clean, TRAILING_PHONE);
        clean = removeKeepingContent(clean, TRAILING_REFERENCE);
        clean = removeKeepingContent(clean, TRAILING_DOMAIN_WORD);
        clean = removeKeepingContent(clean, DOMAIN_TLD);
        clean = removeKeepingContent(clean, TRAILING_ACCOUNT_NUMBER);
        clean = SEPARATORS.matcher(clean).replaceAll(" ");
        clean = WHITESPACE.matcher(clean).replaceAll(" ").strip();

        String[] words = clean.split(" ");
        if (words.length > MAX_WORDS) {
            clean = String.join(" ", Arrays.asList(words).subList(0, MAX_WORDS));
        }
        String trimmed = TRAILING_PUNCTUATION.matcher(clean).replaceAll("").strip();
        return trimmed.isEmpty() ? clean : trimmed;
    }

    private String stripPrefixes(String input) {
        String clean = input;
        boolean changed = true;
        while (changed) {
            changed = false;
            for (String prefix : PREFIXES) {
                if (startsWithPrefix(clean, prefix)) {
                    String rest = clean.substring(prefix.length()).strip();
                    if (!rest.isEmpty()) {
                        clean = rest;
                        changed = true;
                    }
                }
            }
        }
        return clean;
    }

    private String stripSuffixes(String input) {
        String clean = input;
        boolean changed = true;
        while (changed) {
            changed = false;
            for (String suffix : SUFFIXES) {
                if (endsWithWord(clean, suffix)) {
                    String rest = clean.substring(0, clean.length() - suffix.length()).strip();
                    if (!rest.isEmpty()) {
                        clean = rest;
                        changed = true;
                    }
                }
            }
        }
        return clean;
    }

    private static boolean startsWithPrefix(String text, String prefix) {
        if (!text.startsWith(prefix)) {
            return false;
        }
        char last = prefix.charAt(prefix.length() - 1);
        if (!Character.isLetterOrDigit(last) || text.length() == prefix.length()) {
            return true;
        }
        return !Character.isLetterOrDigit(text.charAt(prefix.length()));
    }

    private static boolean endsWithWord(String text, String suffix) {
        if (!text.endsWith(suffix) || text.length() == suffix.length()) {
            return false;
        }
        char before = text.charAt(text.length() - suffix.length() - 1);
        return !Character.isLetterOrDigit(before);
    }

    /** Applies a removal pattern unless it would erase everything. */
    private static String removeKeepingContent(String text, Pattern pattern) {
        String result = pattern.matcher(text).replaceAll("").strip();
        return result.isEmpty() ? text : result;
    }
}
