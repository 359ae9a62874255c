package me.golemcore.clarity.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.clarity.domain.model.RedactionResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces sensitive spans of a transcript with fixed placeholders.
 *
 * <p>
 * Two detector families run over the input:
 * <ul>
 * <li>structural detectors for contact, banking and tax identifiers
 * ({@code [EMAIL]}, {@code [PHONE]}, {@code [IBAN]}, {@code [CARD]} and so
 * on)</li>
 * <li>the user's token dictionary, matched case-insensitively on token
 * boundaries and replaced with {@code [CUSTOM]}</li>
 * </ul>
 *
 * <p>
 * All candidate spans are collected first, then a non-overlapping subset is
 * chosen by kind priority, then span length, then position. The chosen spans
 * are substituted left to right in a single pass, so the output does not
 * depend on the order detectors ran in.
 *
 * <p>
 * The engine is stateless and never caches. Callers that want to skip an
 * unchanged re-run compare {@link RedactionResult#inputHash()} and the
 * dictionary fingerprint themselves.
 */
@Component
@Slf4j
public class RedactionEngine {

    private static final int CARD_CONTEXT_WINDOW = 28;
    private static final List<String> CARD_KEYWORDS = List.of("card", "debit", "credit", "visa", "mastercard",
            "amex", "american express", "cvv", "cvc", "expiry", "expiration", "exp date");

    private static final int CI = Pattern.CASE_INSENSITIVE;

    private static final Pattern EMAIL = Pattern.compile("\\b[A-Z0-9._%+-]+@[A-Z0-9.-]+\\.[A-Z]{2,}\\b", CI);
    private static final Pattern PHONE_INTERNATIONAL = Pattern.compile(
            "(?<![\\w+])(?:\\+|00)\\d(?:[\\s-]?\\(?\\d\\)?)+");
    private static final Pattern PHONE_UK_MOBILE = Pattern.compile(
            "(?<![\\w+])(?:\\+44\\s?7\\d{3}|\\(?07\\d{3}\\)?)\\s?\\d{3}\\s?\\d{3}(?!\\w)");
    private static final Pattern POSTCODE = Pattern.compile("\\b([A-Z]{1,2}\\d{1,2}[A-Z]?)\\s?(\\d[A-Z]{2})\\b", CI);
    private static final Pattern IBAN = Pattern.compile("\\b[A-Z]{2}\\d{2}[A-Z0-9]{11,30}\\b", CI);
    private static final Pattern IBAN_SPACED = Pattern.compile("\\b[A-Z]{2}\\d{2}(?:[\\s-]?[A-Z0-9]){11,40}\\b");
    private static final Pattern SORT_CODE_LABELLED = Pattern.compile(
            "\\b(sort\\s*code|s/c)\\s*(?:is|:)?\\s*(\\d{2}[-\\s]?\\d{2}[-\\s]?\\d{2})\\b", CI);
    private static final Pattern SORT_CODE = Pattern.compile("\\b\\d{2}[-\\s]\\d{2}[-\\s]\\d{2}\\b");
    private static final Pattern ACCOUNT = Pattern.compile(
            "\\b((?:bank\\s*)?account(?:\\s*(?:number|no\\.?|#))?"
                    + "|acc(?:ount)?(?:\\s*(?:number|no\\.?|#))?"
                    + "|acct(?:\\.|ount)?(?:\\s*(?:number|no\\.?|#))?"
                    + "|a/c)\\s*(?:is|:)?\\s*([0-9](?:[0-9\\s-]{3,}[0-9])?)\\b",
            CI);
    private static final Pattern NINO = Pattern.compile("\\b[A-CEGHJ-PR-TW-Z]{2}\\d{6}[A-D]\\b", CI);
    private static final Pattern UTR = Pattern.compile(
            "\\b(utr|unique\\s*taxpayer\\s*reference)\\s*(?:is|:)?\\s*(\\d{10})\\b", CI);
    private static final Pattern VAT = Pattern.compile(
            "\\b(vat\\s*(?:number|no\\.?|#))\\s*(?:is|:)?\\s*(?:GB)?\\s*(\\d{9}(?:\\d{3})?)\\b", CI);
    private static final Pattern BIC = Pattern.compile(
            "\\b(?:bic|swift)(?:\\s*code)?\\s*(?:is|:)?\\s*"
                    + "([A-Z0-9]{4}[\\s-]?[A-Z0-9]{2}[\\s-]?[A-Z0-9]{2}(?:[\\s-]?[A-Z0-9]{3})?)\\b",
            CI);
    private static final Pattern CARD = Pattern.compile("(?<!\\d)\\d(?:[ -]?\\d){12,18}(?!\\d)");

    enum Kind {
        EMAIL("[EMAIL]", 31),
        IBAN("[IBAN]", 30),
        BIC("[BIC]", 29),
        CARD("[CARD]", 28),
        CARD_UNVERIFIED("[CARD?]", 27),
        ACCOUNT("[ACCOUNT]", 26),
        PHONE("[PHONE]", 25),
        SORT_CODE("[SORTCODE]", 24),
        POSTCODE("[POSTCODE]", 23),
        NINO("[NINO]", 22),
        UTR("[UTR]", 21),
        VAT("[VAT]", 20),
        CUSTOM("[CUSTOM]", 10);

        private final String placeholder;
        private final int priority;

        Kind(String placeholder, int priority) {
            this.placeholder = placeholder;
            this.priority = priority;
        }

        String placeholder() {
            return placeholder;
        }
    }

    record Span(int start, int end, Kind kind) {

        int length() {
            return end - start;
        }

        boolean overlaps(Span other) {
            return start < other.end && other.start < end;
        }
    }

    /**
     * Redact {@code rawText} with the structural detectors and the given token
     * dictionary.
     *
     * @param rawText
     *            text to redact; {@code null} is treated as empty
     * @param dictionary
     *            user tokens; blank entries are ignored
     */
    public RedactionResult redact(String rawText, List<String> dictionary) {
        String inputHash = ContentFingerprint.fnv1a64(rawText);
        if (rawText == null || rawText.isEmpty()) {
            return new RedactionResult(rawText == null ? "" : rawText, inputHash, false);
        }

        List<Span> structural = findStructural(rawText);
        List<Span> candidates = new ArrayList<>(structural);
        candidates.addAll(findCustom(rawText, normalizeTokens(dictionary), structural));

        List<Span> chosen = chooseNonOverlapping(candidates);
        if (chosen.isEmpty()) {
            return new RedactionResult(rawText, inputHash, false);
        }

        StringBuilder out = new StringBuilder(rawText.length());
        int cursor = 0;
        for (Span span : chosen) {
            out.append(rawText, cursor, span.start());
            out.append(span.kind().placeholder());
            cursor = span.end();
        }
        out.append(rawText.substring(cursor));

        log.debug("[Redaction] Replaced {} span(s), input {}", chosen.size(), inputHash);
        return new RedactionResult(out.toString(), inputHash, true);
    }

    /**
     * Trim, drop blanks, dedupe case-insensitively (first spelling wins) and
     * order longest first.
     */
    static List<String> normalizeTokens(List<String> dictionary) {
        if (dictionary == null || dictionary.isEmpty()) {
            return List.of();
        }
        Map<String, String> unique = new LinkedHashMap<>();
        for (String token : dictionary) {
            if (token == null) {
                continue;
            }
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                unique.putIfAbsent(trimmed.toLowerCase(Locale.ROOT), trimmed);
            }
        }
        List<String> tokens = new ArrayList<>(unique.values());
        tokens.sort(Comparator.comparingInt(String::length).reversed()
                .thenComparing(token -> token.toLowerCase(Locale.ROOT)));
        return tokens;
    }

    List<Span> findStructural(String text) {
        List<Span> spans = new ArrayList<>();
        addAll(spans, EMAIL, text, 0, Kind.EMAIL);
        addPhones(spans, text);
        addAll(spans, PHONE_UK_MOBILE, text, 0, Kind.PHONE);
        addAll(spans, POSTCODE, text, 0, Kind.POSTCODE);
        addAll(spans, IBAN, text, 0, Kind.IBAN);
        addSpacedIbans(spans, text);
        addAll(spans, SORT_CODE_LABELLED, text, 2, Kind.SORT_CODE);
        addAll(spans, SORT_CODE, text, 0, Kind.SORT_CODE);
        addAccounts(spans, text);
        addAll(spans, NINO, text, 0, Kind.NINO);
        addAll(spans, UTR, text, 2, Kind.UTR);
        addAll(spans, VAT, text, 2, Kind.VAT);
        addBics(spans, text);
        addCards(spans, text);
        return spans;
    }

    private List<Span> findCustom(String text, List<String> tokens, List<Span> structural) {
        List<Span> spans = new ArrayList<>();
        for (String token : tokens) {
            Pattern pattern = Pattern.compile("(?<![\\p{L}\\p{N}_])" + Pattern.quote(token) + "(?![\\p{L}\\p{N}_])",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                Span span = new Span(matcher.start(), matcher.end(), Kind.CUSTOM);
                if (structural.stream().noneMatch(span::overlaps)) {
                    spans.add(span);
                }
            }
        }
        return spans;
    }

    static List<Span> chooseNonOverlapping(List<Span> candidates) {
        List<Span> ordered = new ArrayList<>(candidates);
        ordered.sort(Comparator.comparingInt((Span span) -> span.kind().priority).reversed()
                .thenComparing(Comparator.comparingInt(Span::length).reversed())
                .thenComparingInt(Span::start));

        List<Span> chosen = new ArrayList<>();
        for (Span candidate : ordered) {
            if (candidate.length() > 0 && chosen.stream().noneMatch(candidate::overlaps)) {
                chosen.add(candidate);
            }
        }
        chosen.sort(Comparator.comparingInt(Span::start));
        return chosen;
    }

    private void addAll(List<Span> spans, Pattern pattern, String text, int group, Kind kind) {
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            if (matcher.start(group) >= 0) {
                spans.add(new Span(matcher.start(group), matcher.end(group), kind));
            }
        }
    }

    private void addPhones(List<Span> spans, String text) {
        Matcher matcher = PHONE_INTERNATIONAL.matcher(text);
        while (matcher.find()) {
            int end = matcher.end();
            // A trailing ")" belongs to the surrounding prose, not the number.
            while (end > matcher.start() && !Character.isDigit(text.charAt(end - 1))) {
                end--;
            }
            long digits = countDigits(text.substring(matcher.start(), end));
            if (digits >= 7 && digits <= 15) {
                spans.add(new Span(matcher.start(), end, Kind.PHONE));
            }
        }
    }

    private void addSpacedIbans(List<Span> spans, String text) {
        Matcher matcher = IBAN_SPACED.matcher(text);
        while (matcher.find()) {
            if (isIbanShape(alphanumericOnly(matcher.group()))) {
                spans.add(new Span(matcher.start(), matcher.end(), Kind.IBAN));
            }
        }
    }

    private void addAccounts(List<Span> spans, String text) {
        Matcher matcher = ACCOUNT.matcher(text);
        while (matcher.find()) {
            long digits = countDigits(matcher.group(2));
            if (digits >= 6 && digits <= 12) {
                spans.add(new Span(matcher.start(2), matcher.end(2), Kind.ACCOUNT));
            }
        }
    }

    private void addBics(List<Span> spans, String text) {
        Matcher matcher = BIC.matcher(text);
        while (matcher.find()) {
            String cleaned = alphanumericOnly(matcher.group(1)).toUpperCase(Locale.ROOT);
            if ((cleaned.length() == 8 || cleaned.length() == 11) && cleaned.substring(0, 6).chars()
                    .allMatch(ch -> ch >= 'A' && ch <= 'Z')) {
                spans.add(new Span(matcher.start(1), matcher.end(1), Kind.BIC));
            }
        }
    }

    private void addCards(List<Span> spans, String text) {
        Matcher matcher = CARD.matcher(text);
        while (matcher.find()) {
            String digits = matcher.group().replaceAll("[^0-9]", "");
            if (digits.length() < 13 || digits.length() > 19) {
                continue;
            }
            if (isLuhnValid(digits)) {
                spans.add(new Span(matcher.start(), matcher.end(), Kind.CARD));
            } else if (hasCardContext(text, matcher.start(), matcher.end())) {
                spans.add(new Span(matcher.start(), matcher.end(), Kind.CARD_UNVERIFIED));
            }
        }
    }

    static boolean isLuhnValid(String digits) {
        int sum = 0;
        boolean doubleIt = false;
        for (int i = digits.length() - 1; i >= 0; i--) {
            int digit = digits.charAt(i) - '0';
            if (doubleIt) {
                digit *= 2;
                if (digit > 9) {
                    digit -= 9;
                }
            }
            sum += digit;
            doubleIt = !doubleIt;
        }
        return sum % 10 == 0;
    }

    private boolean hasCardContext(String text, int start, int end) {
        int from = Math.max(0, start - CARD_CONTEXT_WINDOW);
        int to = Math.min(text.length(), end + CARD_CONTEXT_WINDOW);
        String window = text.substring(from, to).toLowerCase(Locale.ROOT);
        return CARD_KEYWORDS.stream().anyMatch(window::contains);
    }

    private static boolean isIbanShape(String cleaned) {
        if (cleaned.length() < 15 || cleaned.length() > 34) {
            return false;
        }
        return Character.isLetter(cleaned.charAt(0)) && Character.isLetter(cleaned.charAt(1))
                && Character.isDigit(cleaned.charAt(2)) && Character.isDigit(cleaned.charAt(3));
    }

    private static String alphanumericOnly(String value) {
        return value.replaceAll("[^A-Za-z0-9]", "");
    }

    private static long countDigits(String value) {
        return value.chars().filter(Character::isDigit).count();
    }
}
