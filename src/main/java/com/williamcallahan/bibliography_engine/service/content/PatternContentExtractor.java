/**
 * Regular-expression based identifier and metadata extraction from paper text
 *
 * @author William Callahan
 *
 * Features:
 * - Ordered identifier strategies (DOI, arXiv, bibcode) over the text header
 * - Trailing punctuation stripped from DOIs found in running text
 * - Title, year and first-author surname heuristics for papers without identifiers
 */
package com.williamcallahan.bibliography_engine.service.content;

import com.williamcallahan.bibliography_engine.config.AppConfigurationProperties;
import com.williamcallahan.bibliography_engine.types.InferredMetadata;
import com.williamcallahan.bibliography_engine.types.PaperIdentifiers;
import com.williamcallahan.bibliography_engine.util.ValidationUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class PatternContentExtractor implements ContentExtractor {

    static final int DEFAULT_SCAN_LENGTH = 5000;
    private static final int YEAR_SCAN_LENGTH = 3000;
    private static final int TITLE_MAX_LENGTH = 300;

    private static final List<Pattern> DOI_PATTERNS = List.of(
        Pattern.compile("DOI[:\\s]+\\s*(10\\.\\d{4,}/[^\\s<>]+)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("doi\\.org/(10\\.\\d{4,}/[^\\s<>]+)", Pattern.CASE_INSENSITIVE)
    );
    private static final Pattern DOI_TRAILING_PUNCTUATION = Pattern.compile("[.,;)\\]]+$");

    private static final List<Pattern> ARXIV_PATTERNS = List.of(
        Pattern.compile("arXiv[:\\s]+(\\d{4}\\.\\d{4,5}(?:v\\d+)?)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("arxiv\\.org/(?:abs|pdf)/(\\d{4}\\.\\d{4,5}(?:v\\d+)?)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("arXiv[:\\s]+([a-z-]+/\\d{7}(?:v\\d+)?)", Pattern.CASE_INSENSITIVE)
    );

    // YYYY JJJJJ VVVV M PPPP A
    private static final Pattern BIBCODE_PATTERN =
        Pattern.compile("(\\d{4}[A-Za-z&.]{5}[A-Za-z0-9.]{4}[A-Za-z.][A-Za-z0-9.]{4}[A-Z.])");

    private static final Pattern NUMERIC_LINE = Pattern.compile("^\\d+$");
    private static final Pattern HEADER_LINE = Pattern.compile("^(page|vol|volume|issue|doi|arxiv)", Pattern.CASE_INSENSITIVE);

    private static final String MONTHS =
        "(?:January|February|March|April|May|June|July|August|September|October|November|December)";
    private static final List<Pattern> YEAR_PATTERNS = List.of(
        Pattern.compile("(?:published|submitted|received|accepted|copyright|\\(c\\)|©)\\s*(?:\\w+\\s*)?(\\d{4})", Pattern.CASE_INSENSITIVE),
        Pattern.compile("(\\d{4})\\s*" + MONTHS, Pattern.CASE_INSENSITIVE),
        Pattern.compile(MONTHS + "\\s*(?:\\d{1,2})?,?\\s*(\\d{4})", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\b(20[0-3][0-9])\\b")
    );
    private static final int MIN_YEAR = 1990;
    private static final int MAX_YEAR = 2030;

    private static final Pattern AFFILIATION = Pattern.compile("university|institute|department|laboratory|center|college", Pattern.CASE_INSENSITIVE);
    private static final Pattern AUTHOR_NAME = Pattern.compile("^([A-Z][a-z]+(?:\\s+[A-Z]\\.?(?=\\s|$))*(?:\\s+[A-Z][a-z]+)?)");

    private final List<IdentifierStrategy> strategies;
    private final int scanLength;

    @Autowired
    public PatternContentExtractor(AppConfigurationProperties properties) {
        this(properties.getSync().getContentScanLength());
    }

    PatternContentExtractor(int scanLength) {
        this.scanLength = scanLength > 0 ? scanLength : DEFAULT_SCAN_LENGTH;
        this.strategies = List.of(
            header -> firstMatch(DOI_PATTERNS, header)
                .map(doi -> DOI_TRAILING_PUNCTUATION.matcher(doi).replaceAll(""))
                .map(doi -> PaperIdentifiers.builder().doi(doi).build())
                .orElse(PaperIdentifiers.none()),
            header -> firstMatch(ARXIV_PATTERNS, header)
                .map(arxiv -> PaperIdentifiers.builder().arxivId(arxiv).build())
                .orElse(PaperIdentifiers.none()),
            header -> firstMatch(List.of(BIBCODE_PATTERN), header)
                .map(bibcode -> PaperIdentifiers.builder().bibcode(bibcode).build())
                .orElse(PaperIdentifiers.none())
        );
    }

    @Override
    public PaperIdentifiers extractIdentifiers(String text) {
        if (!ValidationUtils.hasText(text)) {
            return PaperIdentifiers.none();
        }
        String header = text.substring(0, Math.min(text.length(), scanLength));
        PaperIdentifiers result = PaperIdentifiers.none();
        for (IdentifierStrategy strategy : strategies) {
            result = result.orElse(strategy.extract(header));
        }
        return result;
    }

    @Override
    public InferredMetadata extractMetadata(String text) {
        if (!ValidationUtils.hasText(text)) {
            return InferredMetadata.none();
        }
        List<String> lines = Arrays.stream(text.split("\n"))
            .filter(line -> !line.trim().isEmpty())
            .toList();
        return InferredMetadata.builder()
            .title(inferTitle(lines))
            .year(inferYear(text.substring(0, Math.min(text.length(), YEAR_SCAN_LENGTH))))
            .firstAuthor(inferFirstAuthor(lines))
            .build();
    }

    private static String inferTitle(List<String> lines) {
        for (int i = 0; i < Math.min(lines.size(), 10); i++) {
            String line = lines.get(i).trim();
            if (line.length() > 20
                    && !NUMERIC_LINE.matcher(line).matches()
                    && !line.contains("@")
                    && !HEADER_LINE.matcher(line).find()) {
                return line.length() > TITLE_MAX_LENGTH ? line.substring(0, TITLE_MAX_LENGTH) : line;
            }
        }
        return null;
    }

    private static Integer inferYear(String header) {
        for (Pattern pattern : YEAR_PATTERNS) {
            Matcher matcher = pattern.matcher(header);
            if (matcher.find()) {
                int year = Integer.parseInt(matcher.group(1));
                if (year >= MIN_YEAR && year <= MAX_YEAR) {
                    return year;
                }
            }
        }
        return null;
    }

    // Author lines usually sit between the title and the abstract
    private static String inferFirstAuthor(List<String> lines) {
        for (int i = 1; i < Math.min(lines.size(), 15); i++) {
            String line = lines.get(i).trim();
            if (AFFILIATION.matcher(line).find() || line.contains("@") || (!line.isEmpty() && Character.isDigit(line.charAt(0)))) {
                continue;
            }
            Matcher matcher = AUTHOR_NAME.matcher(line);
            if (matcher.find() && matcher.group(1).length() > 3) {
                String[] parts = matcher.group(1).split("\\s+");
                return parts[parts.length - 1];
            }
        }
        return null;
    }

    private static Optional<String> firstMatch(List<Pattern> patterns, String header) {
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(header);
            if (matcher.find()) {
                return Optional.of(matcher.group(1));
            }
        }
        return Optional.empty();
    }
}
