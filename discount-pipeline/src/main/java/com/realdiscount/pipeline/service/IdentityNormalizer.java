package com.realdiscount.pipeline.service;

import com.realdiscount.pipeline.model.NormalizedIdentity;
import com.realdiscount.pipeline.model.RawOffer;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cleans raw brand / size / category / title strings into comparable tokens.
 *
 * Pure functions of the input strings: no lookups, no side effects. Anything that cannot be
 * understood degrades to a neutral value (null size, "other" category) instead of failing.
 */
@Component
public class IdentityNormalizer {

    public static final String CATEGORY_OTHER = "other";

    // Longer unit spellings first so "ml" wins over "l" and "kg" over "g"
    private static final Pattern SIZE_PATTERN = Pattern.compile(
            "(\\d+(?:[.,]\\d+)?)\\s*(kg|mg|ml|lts|lt|l|grs|gr|g|unidades|unid|un|u|capsulas|caps|comprimidos|tabs)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_DIGIT = Pattern.compile("\\D");

    // unit → {canonical unit, multiplier}
    private static final Map<String, Object[]> UNIT_MAP = Map.ofEntries(
            Map.entry("kg", new Object[]{"g", 1000.0}),
            Map.entry("g", new Object[]{"g", 1.0}),
            Map.entry("gr", new Object[]{"g", 1.0}),
            Map.entry("grs", new Object[]{"g", 1.0}),
            Map.entry("mg", new Object[]{"g", 0.001}),
            Map.entry("l", new Object[]{"ml", 1000.0}),
            Map.entry("lt", new Object[]{"ml", 1000.0}),
            Map.entry("lts", new Object[]{"ml", 1000.0}),
            Map.entry("ml", new Object[]{"ml", 1.0}),
            Map.entry("un", new Object[]{"un", 1.0}),
            Map.entry("u", new Object[]{"un", 1.0}),
            Map.entry("unid", new Object[]{"un", 1.0}),
            Map.entry("unidades", new Object[]{"un", 1.0}),
            Map.entry("caps", new Object[]{"un", 1.0}),
            Map.entry("capsulas", new Object[]{"un", 1.0}),
            Map.entry("comprimidos", new Object[]{"un", 1.0}),
            Map.entry("tabs", new Object[]{"un", 1.0})
    );

    // Brand spellings seen across retailers → one canonical brand
    private static final Map<String, String> BRAND_ALIASES = Map.ofEntries(
            Map.entry("la roche posay", "la roche-posay"),
            Map.entry("laroche posay", "la roche-posay"),
            Map.entry("la rocheposay", "la roche-posay"),
            Map.entry("lrp", "la roche-posay"),
            Map.entry("cera ve", "cerave"),
            Map.entry("avene", "avene"),
            Map.entry("eau thermale avene", "avene"),
            Map.entry("isdin", "isdin"),
            Map.entry("eucerin", "eucerin"),
            Map.entry("bioderma", "bioderma"),
            Map.entry("vichy", "vichy"),
            Map.entry("neutrogena", "neutrogena"),
            Map.entry("the ordinary", "the ordinary"),
            Map.entry("loreal paris", "l'oreal paris"),
            Map.entry("l oreal paris", "l'oreal paris"),
            Map.entry("l'oreal", "l'oreal paris"),
            Map.entry("loreal", "l'oreal paris")
    );

    // Ordered: the first taxonomy slug whose keyword appears wins
    private static final Map<String, List<String>> CATEGORY_RULES;

    static {
        Map<String, List<String>> rules = new LinkedHashMap<>();
        rules.put("sunscreen", List.of("protector solar", "bloqueador", "fotoprotector", "solar", "fps", "spf", "sunscreen", "anthelios"));
        rules.put("cleanser", List.of("limpiador", "limpieza", "micelar", "desmaquillante", "cleanser", "jabon"));
        rules.put("eye-care", List.of("contorno de ojos", "contorno", "ojeras", "eye"));
        rules.put("serum", List.of("serum", "suero", "ampolla"));
        rules.put("acne", List.of("acne", "imperfecciones", "espinillas", "blemish"));
        rules.put("body-care", List.of("corporal", "cuerpo", "body", "locion"));
        rules.put("moisturizer", List.of("hidratante", "humectante", "crema", "moisturizer", "hydrating"));
        CATEGORY_RULES = Collections.unmodifiableMap(rules);
    }

    private static final Set<String> STOP_WORDS = Set.of(
            "de", "del", "la", "el", "los", "las", "con", "para", "y", "en", "x", "por",
            "the", "for", "with", "and", "of", "a");

    public record Size(Double value, String unit) {
        static final Size UNKNOWN = new Size(null, null);
    }

    public NormalizedIdentity normalize(RawOffer offer) {
        return normalize(offer.getTitle(), offer.getBrandRaw(), offer.getSizeRaw(),
                offer.getCategoryRaw(), offer.getEan());
    }

    public NormalizedIdentity normalize(String title, String brandRaw, String sizeRaw,
                                        String categoryRaw, String eanRaw) {
        String brand = normalizeBrand(brandRaw);
        Size size = parseSize(sizeRaw);
        if (size.value() == null) {
            // Many listings only carry the size inside the title
            size = parseSize(title);
        }
        String name = normalizeName(title, brand);
        String category = normalizeCategory(categoryRaw, title);
        return new NormalizedIdentity(name, nameTokens(name), brand, size.value(), size.unit(),
                category, normalizeEan(eanRaw));
    }

    /**
     * Lower-case, accent-free, trimmed text with collapsed whitespace. Null becomes "".
     */
    public String normalizeText(String value) {
        if (value == null) return "";
        String decomposed = java.text.Normalizer.normalize(value, java.text.Normalizer.Form.NFD);
        String stripped = MARKS.matcher(decomposed).replaceAll("");
        return WHITESPACE.matcher(stripped.toLowerCase(Locale.ROOT).trim()).replaceAll(" ");
    }

    public String normalizeBrand(String brandRaw) {
        String text = normalizeText(brandRaw);
        if (text.isEmpty()) return "";
        String alias = BRAND_ALIASES.get(text);
        if (alias != null) return alias;
        alias = BRAND_ALIASES.get(punctuationToSpace(text));
        return alias != null ? alias : text;
    }

    /**
     * "150 ml" → (150.0, "ml"); "1,5 L" → (1500.0, "ml"); "1 kg" → (1000.0, "g").
     * Unparsable input yields a null value and unit.
     */
    public Size parseSize(String sizeRaw) {
        if (sizeRaw == null || sizeRaw.isBlank()) return Size.UNKNOWN;
        Matcher m = SIZE_PATTERN.matcher(normalizeText(sizeRaw));
        if (!m.find()) return Size.UNKNOWN;
        double value;
        try {
            value = Double.parseDouble(m.group(1).replace(',', '.'));
        } catch (NumberFormatException e) {
            return Size.UNKNOWN;
        }
        Object[] unit = UNIT_MAP.get(m.group(2).toLowerCase(Locale.ROOT));
        if (unit == null) return Size.UNKNOWN;
        double canonical = Math.round(value * (Double) unit[1] * 1000d) / 1000d;
        return new Size(canonical, (String) unit[0]);
    }

    /**
     * Maps the raw category, then the title, onto the fixed taxonomy.
     */
    public String normalizeCategory(String categoryRaw, String title) {
        String fromCategory = matchCategory(normalizeText(categoryRaw));
        if (!CATEGORY_OTHER.equals(fromCategory)) return fromCategory;
        return matchCategory(normalizeText(title));
    }

    /**
     * Title without brand words and size expressions, punctuation folded to single spaces.
     */
    public String normalizeName(String title, String brand) {
        String text = SIZE_PATTERN.matcher(normalizeText(title)).replaceAll(" ");
        String padded = " " + punctuationToSpace(text) + " ";
        if (brand != null && !brand.isEmpty()) {
            for (String spelling : brandSpellings(brand)) {
                padded = padded.replace(" " + spelling + " ", " ");
            }
        }
        return WHITESPACE.matcher(padded.trim()).replaceAll(" ");
    }

    public Set<String> nameTokens(String name) {
        Set<String> tokens = new LinkedHashSet<>();
        if (name == null || name.isBlank()) return tokens;
        for (String token : name.split(" ")) {
            if (!token.isEmpty() && !STOP_WORDS.contains(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /** Digits only, 8 to 14 long (EAN-8 … GTIN-14); anything else is treated as missing. */
    public String normalizeEan(String eanRaw) {
        if (eanRaw == null) return null;
        String digits = NON_DIGIT.matcher(eanRaw).replaceAll("");
        return digits.length() >= 8 && digits.length() <= 14 ? digits : null;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private String matchCategory(String text) {
        if (text.isEmpty()) return CATEGORY_OTHER;
        for (Map.Entry<String, List<String>> rule : CATEGORY_RULES.entrySet()) {
            for (String keyword : rule.getValue()) {
                if (text.contains(keyword)) return rule.getKey();
            }
        }
        return CATEGORY_OTHER;
    }

    private Set<String> brandSpellings(String brand) {
        Set<String> spellings = new LinkedHashSet<>();
        spellings.add(punctuationToSpace(brand));
        for (Map.Entry<String, String> alias : BRAND_ALIASES.entrySet()) {
            if (alias.getValue().equals(brand)) {
                spellings.add(punctuationToSpace(alias.getKey()));
            }
        }
        spellings.removeIf(String::isEmpty);
        return spellings;
    }

    private String punctuationToSpace(String text) {
        return NON_ALNUM.matcher(text).replaceAll(" ").trim();
    }
}
