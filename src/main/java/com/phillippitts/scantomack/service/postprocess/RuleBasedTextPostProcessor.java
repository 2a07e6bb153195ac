package com.phillippitts.scantomack.service.postprocess;

import com.phillippitts.scantomack.domain.ProcessingOptions;
import com.phillippitts.scantomack.domain.TextCorrection;
import com.phillippitts.scantomack.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Regex-driven correction of typical OCR confusions in business documents.
 *
 * <p>Rules run in declaration order, each on the output of the previous one; correction
 * positions refer to the text the rule ran on. Letter-for-digit fixes only fire next to digits,
 * so ordinary words are left alone.
 *
 * <p>Semantic confidence is the share of words found in a small English and business-term
 * dictionary. It is a cheap plausibility signal, not a language model.
 */
public class RuleBasedTextPostProcessor implements TextPostProcessor {

    private static final Logger LOG = LogManager.getLogger(RuleBasedTextPostProcessor.class);

    private static final Pattern NON_LETTERS = Pattern.compile("[^\\p{L}]");
    private static final Pattern WORD_SPLIT = Pattern.compile("\\s+");

    private static final List<Rule> RULES = List.of(
            Rule.fixed("\\b[Oo](?=\\d)", "0", "Letter O to digit 0 before digits", 0.8),
            Rule.fixed("(?<=\\d)[Oo]\\b", "0", "Letter O to digit 0 after digits", 0.8),
            Rule.fixed("\\bl(?=\\d)", "1", "Lowercase l to digit 1", 0.9),
            Rule.fixed("(?<=\\d)l\\b", "1", "Lowercase l to digit 1 at end", 0.9),
            Rule.fixed("\\bS(?=\\d)", "5", "S to digit 5", 0.7),
            Rule.fixed("\\bG(?=\\d)", "6", "G to digit 6", 0.7),
            Rule.fixed("\\bB(?=\\d)", "8", "B to digit 8", 0.6),
            Rule.fixed("(?i)\\bsubtotal\\s+:", "Subtotal:", "Subtotal label formatting", 0.9),
            Rule.fixed("(?i)\\btotal\\s+:", "Total:", "Total label formatting", 0.9),
            Rule.fixed("(?i)\\btax\\s+:", "Tax:", "Tax label formatting", 0.9),
            new Rule(Pattern.compile("\\$\\s+(\\d)"), m -> "$" + m.group(1), "Currency symbol spacing", 0.9),
            Rule.fixed("[ \\t]{2,}", " ", "Collapse repeated whitespace", 1.0),
            Rule.fixed("[ \\t]+(?=\\n)|(?<=\\n)[ \\t]+", "", "Trim line whitespace", 1.0)
    );

    private static final Set<String> COMMON_WORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by", "from",
            "up", "about", "into", "over", "after", "is", "are", "was", "were", "be", "been", "being",
            "have", "has", "had", "do", "does", "did", "will", "would", "could", "should", "may", "might",
            "must", "i", "you", "he", "she", "it", "we", "they", "me", "him", "her", "us", "them", "my",
            "your", "his", "its", "our", "their", "this", "that", "these", "those", "here", "there",
            "where", "when", "why", "how", "what", "who", "which", "whose", "price", "cost", "amount",
            "qty", "item", "product", "company", "business", "store", "shop", "date", "time", "name",
            "first", "last", "middle", "number", "account", "reference", "description", "details",
            "notes", "comments", "zero", "one", "two", "three", "four", "five", "six", "seven", "eight",
            "nine", "ten", "twenty", "thirty", "forty", "fifty", "hundred", "thousand", "million",
            "new", "old", "good", "bad", "big", "small", "large", "little", "long", "short", "high",
            "low", "right", "left", "next", "second", "get", "go", "come", "see", "look", "use", "make",
            "take", "give", "put", "say", "tell", "know", "think", "feel", "find", "work", "call", "try",
            "total", "no", "not", "all", "per", "page", "due", "paid", "please", "thank");

    private static final Set<String> DOMAIN_TERMS = Set.of(
            "invoice", "receipt", "payment", "billing", "remittance", "statement", "balance", "credit",
            "debit", "refund", "adjustment", "subtotal", "tax", "vat", "gst", "hst", "pst", "discount",
            "surcharge", "fee", "shipping", "handling", "freight", "sku", "upc", "barcode", "model",
            "serial", "lot", "batch", "expiry", "warranty", "brand", "manufacturer", "quantity", "weight",
            "volume", "dimensions", "color", "size", "grade", "quality", "purchase", "order", "quote",
            "estimate", "proposal", "contract", "agreement", "terms", "conditions", "vendor", "supplier",
            "distributor", "wholesaler", "retailer", "customer", "client", "buyer", "seller", "delivery",
            "pickup", "shipment", "tracking", "logistics", "warehouse", "inventory", "stock", "address",
            "street", "avenue", "road", "boulevard", "suite", "apartment", "unit", "floor", "building",
            "city", "state", "province", "country", "postal", "zip", "code", "phone", "fax", "email",
            "website", "piece", "each", "dozen", "pair", "set", "box", "case", "pallet", "pound",
            "kilogram", "gram", "ounce", "liter", "gallon", "quart", "pint", "cup", "meter", "foot",
            "inch", "yard", "centimeter", "millimeter");

    private static final Set<String> DICTIONARY = Stream.concat(COMMON_WORDS.stream(), DOMAIN_TERMS.stream())
            .collect(Collectors.toUnmodifiableSet());

    @Override
    public PostProcessingResult process(String text, ProcessingOptions options) {
        Objects.requireNonNull(text, "text");
        List<TextCorrection> corrections = new ArrayList<>();
        String current = text;
        for (Rule rule : RULES) {
            current = rule.apply(current, corrections);
        }
        double semantic = semanticConfidence(current);
        if (!corrections.isEmpty()) {
            LOG.debug("Applied {} corrections (preview='{}')", corrections.size(), LogSanitizer.preview(current));
        }
        return new PostProcessingResult(current, corrections, semantic);
    }

    /**
     * Share of words (letters only, lower-cased) found in the dictionary. 0 when there are no words.
     */
    static double semanticConfidence(String text) {
        int words = 0;
        int known = 0;
        for (String token : WORD_SPLIT.split(text.toLowerCase(Locale.ROOT))) {
            String word = NON_LETTERS.matcher(token).replaceAll("");
            if (word.isEmpty()) {
                continue;
            }
            words++;
            if (DICTIONARY.contains(word)) {
                known++;
            }
        }
        return words == 0 ? 0.0 : (double) known / words;
    }

    private record Rule(Pattern pattern, Function<MatchResult, String> replacement, String description,
                        double confidence) {

        static Rule fixed(String regex, String replacement, String description, double confidence) {
            return new Rule(Pattern.compile(regex), m -> replacement, description, confidence);
        }

        String apply(String input, List<TextCorrection> sink) {
            Matcher matcher = pattern.matcher(input);
            if (!matcher.find()) {
                return input;
            }
            matcher.reset();
            return matcher.replaceAll(m -> {
                String corrected = replacement.apply(m);
                if (!corrected.equals(m.group())) {
                    sink.add(new TextCorrection(m.start(), m.group(), corrected, description, confidence));
                }
                return Matcher.quoteReplacement(corrected);
            });
        }
    }
}
