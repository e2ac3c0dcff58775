package com.dramacollector.collect.validation;

import com.dramacollector.collect.model.CanonicalRecord;
import com.dramacollector.collect.model.DramaAttributes;
import com.dramacollector.collect.model.DramaField;
import com.dramacollector.collect.model.ValidationResult;
import com.dramacollector.config.CollectorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Scores a canonical record from 0 to 10. Every error costs two points and every warning
 * half a point; the result is then scaled by how many of the important fields are filled.
 *
 * <p>Field-level problems are errors only under {@link ValidationLevel#STRICT}; the other
 * levels report them as warnings. Missing required fields are always errors.
 */
@Component
public class DramaQualityValidator implements RecordValidator {
    private static final Logger log = LoggerFactory.getLogger(DramaQualityValidator.class);
    private static final Set<DramaField> IMPORTANT_FIELDS = EnumSet.of(
        DramaField.TITLE,
        DramaField.YEAR,
        DramaField.SYNOPSIS,
        DramaField.GENRES,
        DramaField.RATING,
        DramaField.CASTS,
        DramaField.DIRECTORS,
        DramaField.EPISODES
    );
    private static final Pattern SPECIAL_CHARS = Pattern.compile("[<>\"'&]");
    private static final int MAX_NAME_LENGTH = 50;

    private final ValidationLevel level;
    private final Clock clock;

    @Autowired
    public DramaQualityValidator(CollectorProperties properties, Clock clock) {
        this(ValidationLevel.parse(properties.getProcessing().getValidationLevel()), clock);
        log.info("Record validation level {}", level);
    }

    public DramaQualityValidator(ValidationLevel level, Clock clock) {
        this.level = level;
        this.clock = clock;
    }

    public ValidationLevel level() {
        return level;
    }

    @Override
    public ValidationResult validate(CanonicalRecord record) {
        DramaAttributes attributes = record.attributes();
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (DramaField required : requiredFields()) {
            if (!attributes.has(required)) {
                errors.add("missing required field: " + required.key());
            }
        }

        List<String> fieldProblems = new ArrayList<>();
        checkTitle(attributes.title(), fieldProblems, warnings);
        checkYear(attributes.year(), fieldProblems, warnings);
        checkRating(attributes.rating(), fieldProblems);
        checkSynopsis(attributes.synopsis(), warnings);
        checkGenres(attributes, warnings);
        checkNames("cast", attributes.casts(), 20, warnings);
        checkNames("director", attributes.directors(), 5, warnings);
        checkEpisodes(attributes.episodes(), warnings);
        if (level == ValidationLevel.STRICT) {
            errors.addAll(fieldProblems);
        } else {
            warnings.addAll(fieldProblems);
        }

        checkConsistency(attributes, warnings);

        double score = score(attributes, errors.size(), warnings.size());
        return new ValidationResult(score, errors, warnings);
    }

    static double completeness(DramaAttributes attributes) {
        int filled = 0;
        for (DramaField field : IMPORTANT_FIELDS) {
            if (attributes.has(field)) {
                filled++;
            }
        }
        return (double) filled / IMPORTANT_FIELDS.size();
    }

    static double score(DramaAttributes attributes, int errorCount, int warningCount) {
        double base = 10.0 - errorCount * 2.0 - warningCount * 0.5;
        double scaled = base * (0.5 + 0.5 * completeness(attributes));
        return Math.max(0.0, Math.min(10.0, scaled));
    }

    private Set<DramaField> requiredFields() {
        return switch (level) {
            case STRICT -> EnumSet.of(DramaField.TITLE, DramaField.YEAR, DramaField.SYNOPSIS);
            case MODERATE -> EnumSet.of(DramaField.TITLE);
            case LENIENT -> EnumSet.noneOf(DramaField.class);
        };
    }

    private void checkTitle(String title, List<String> problems, List<String> warnings) {
        if (title == null) {
            return;
        }
        String cleaned = title.replaceAll("【.*?】", "").replaceAll("\\[.*?]", "").trim();
        if (cleaned.length() < 2) {
            problems.add("title too short");
        } else if (cleaned.length() > 100) {
            warnings.add("title too long");
        }
        if (SPECIAL_CHARS.matcher(cleaned).find()) {
            warnings.add("title contains special characters");
        }
    }

    private void checkYear(Integer year, List<String> problems, List<String> warnings) {
        if (year == null) {
            return;
        }
        int currentYear = clock.instant().atZone(ZoneOffset.UTC).getYear();
        if (year < 1900) {
            problems.add("year too early");
        } else if (year > currentYear + 2) {
            problems.add("year too far in the future");
        } else if (year > currentYear) {
            warnings.add("year is in the future");
        }
    }

    private void checkRating(Double rating, List<String> problems) {
        if (rating != null && rating > 10) {
            problems.add("rating above 10");
        }
    }

    private void checkSynopsis(String synopsis, List<String> warnings) {
        if (synopsis == null) {
            return;
        }
        String cleaned = synopsis.replaceAll("<[^>]+>", "").replaceAll("\\s+", " ").trim();
        if (cleaned.length() < 10) {
            warnings.add("synopsis too short");
        } else if (cleaned.length() > 2000) {
            warnings.add("synopsis too long");
        }
    }

    private void checkGenres(DramaAttributes attributes, List<String> warnings) {
        if (attributes.genres().size() > 10) {
            warnings.add("too many genres");
        }
    }

    private void checkNames(String label, List<String> names, int maxCount, List<String> warnings) {
        for (String name : names) {
            if (name.length() > MAX_NAME_LENGTH) {
                warnings.add(label + " name too long: " + name.substring(0, 20) + "...");
            }
        }
        if (names.size() > maxCount) {
            warnings.add("too many " + label + " entries");
        }
    }

    private void checkEpisodes(Integer episodes, List<String> warnings) {
        if (episodes != null && episodes > 200) {
            warnings.add("episode count unusually high");
        }
    }

    private void checkConsistency(DramaAttributes attributes, List<String> warnings) {
        Integer year = attributes.year();
        Double rating = attributes.rating();
        if (year != null && rating != null && year < 2000 && rating > 9) {
            warnings.add("unusually high rating for an early title");
        }
        String title = attributes.title() == null ? "" : attributes.title().toLowerCase(Locale.ROOT);
        if (title.contains("爱情") || title.contains("恋爱")) {
            boolean romance = attributes.genres().stream()
                .anyMatch(genre -> genre.contains("爱情") || genre.toLowerCase(Locale.ROOT).contains("romance"));
            if (!romance) {
                warnings.add("title suggests romance but genres do not");
            }
        }
    }
}
