package com.resume.network.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.resume.network.core.model.SeniorityTier;
import com.resume.network.ingestion.FlexibleDateParser;
import com.resume.network.ingestion.FlexibleDateParser.ParsedDate;
import com.resume.network.query.DateRange;
import com.resume.network.query.QueryValidationException;
import com.resume.network.query.QueryValidator;
import com.resume.network.query.SkillMatchMode;
import com.resume.network.query.StructuredQuery;
import com.resume.network.rules.DefaultNormalizationRules;
import com.resume.network.rules.NormalizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns untrusted oracle output into a {@link StructuredQuery}.
 *
 * <p>Only the recognized fields are read; any other field is ignored. Recognized fields must
 * have the expected shape, dates must parse, skill tokens must not be blank, and organization
 * or department names must normalize to a usable key. A response that yields no filter at all
 * is rejected too, so that the keyword fallback gets a chance.</p>
 */
public class OracleResponseValidator {
    private static final Logger log = LoggerFactory.getLogger(OracleResponseValidator.class);

    static final Set<String> RECOGNIZED_FIELDS = Set.of(
            "organization", "department", "skills", "skill_mode", "date_from", "date_to",
            "seniority", "min_experience_years", "terms");

    private static final int MAX_TEXT_LENGTH = 200;
    private static final int MAX_LIST_SIZE = 50;

    private final ObjectMapper objectMapper;
    private final NormalizationEngine normalizationEngine;
    private final FlexibleDateParser dateParser;

    public OracleResponseValidator() {
        this(new ObjectMapper(), DefaultNormalizationRules.createDefaultEngine());
    }

    public OracleResponseValidator(NormalizationEngine normalizationEngine) {
        this(new ObjectMapper(), normalizationEngine);
    }

    public OracleResponseValidator(ObjectMapper objectMapper, NormalizationEngine normalizationEngine) {
        this.objectMapper = objectMapper;
        this.normalizationEngine = normalizationEngine;
        this.dateParser = new FlexibleDateParser();
    }

    /**
     * @throws InvalidOracleResponseException if the response is malformed or invalid
     */
    public StructuredQuery validate(OracleResponse response) {
        JsonNode root = parse(response.content());

        StructuredQuery.Builder builder = StructuredQuery.builder();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        LocalDate from = null;
        LocalDate to = null;
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey().toLowerCase(Locale.ROOT);
            JsonNode value = field.getValue();
            if (!RECOGNIZED_FIELDS.contains(name)) {
                log.debug("oracle.field.ignored field={}", field.getKey());
                continue;
            }
            if (value == null || value.isNull()) {
                continue;
            }
            switch (name) {
                case "organization" -> builder.organization(organization(value));
                case "department" -> builder.department(department(value));
                case "skills" -> builder.skills(strings(name, value));
                case "skill_mode" -> builder.skillMatchMode(skillMode(value));
                case "date_from" -> from = date(name, value);
                case "date_to" -> to = date(name, value);
                case "seniority" -> builder.seniority(seniority(value));
                case "min_experience_years" -> builder.minExperienceYears(years(value));
                case "terms" -> builder.freeTextTerms(strings(name, value));
                default -> throw new IllegalStateException("Unhandled recognized field " + name);
            }
        }
        if (from != null || to != null) {
            builder.dateRange(DateRange.between(from, to));
        }

        StructuredQuery query = builder.build();
        try {
            QueryValidator.validate(query);
        } catch (QueryValidationException e) {
            throw new InvalidOracleResponseException("Oracle query rejected: " + e.getMessage(), e);
        }
        if (query.isEmpty()) {
            throw new InvalidOracleResponseException("Oracle response contains no usable filter");
        }
        return query;
    }

    private JsonNode parse(String content) {
        String json = extractObject(content);
        try {
            JsonNode root = objectMapper.readTree(json);
            if (root == null || !root.isObject()) {
                throw new InvalidOracleResponseException("Oracle response is not a JSON object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new InvalidOracleResponseException("Malformed oracle response: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Strips prose or code fences around the first JSON object.
     */
    static String extractObject(String content) {
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start < 0 || end < start) {
            throw new InvalidOracleResponseException("Oracle response contains no JSON object");
        }
        return content.substring(start, end + 1);
    }

    private static String text(String field, JsonNode value) {
        if (!value.isTextual()) {
            throw new InvalidOracleResponseException(field + " must be a string");
        }
        String text = value.asText().trim();
        if (text.length() > MAX_TEXT_LENGTH) {
            throw new InvalidOracleResponseException(field + " is too long");
        }
        return text;
    }

    private String organization(JsonNode value) {
        String organization = text("organization", value);
        if (normalizationEngine.organizationKey(organization).isEmpty()) {
            throw new InvalidOracleResponseException("organization has no usable name: '" + organization + "'");
        }
        return organization;
    }

    private String department(JsonNode value) {
        String department = text("department", value);
        if (normalizationEngine.departmentKey(department).isEmpty()) {
            throw new InvalidOracleResponseException("department has no usable name: '" + department + "'");
        }
        return department;
    }

    private static List<String> strings(String field, JsonNode value) {
        List<String> values = new ArrayList<>();
        if (value.isTextual()) {
            for (String token : value.asText().split("\\s*,\\s*")) {
                values.add(token.trim());
            }
        } else if (value.isArray()) {
            for (JsonNode item : value) {
                values.add(text(field, item));
            }
        } else {
            throw new InvalidOracleResponseException(field + " must be a list of strings");
        }
        if (values.size() > MAX_LIST_SIZE) {
            throw new InvalidOracleResponseException(field + " has too many entries");
        }
        for (String item : values) {
            if (item.isBlank()) {
                throw new InvalidOracleResponseException(field + " contains a blank entry");
            }
        }
        return values;
    }

    private static SkillMatchMode skillMode(JsonNode value) {
        String mode = text("skill_mode", value).toUpperCase(Locale.ROOT);
        try {
            return SkillMatchMode.valueOf(mode);
        } catch (IllegalArgumentException e) {
            throw new InvalidOracleResponseException("skill_mode must be 'all' or 'any', got '" + mode + "'", e);
        }
    }

    private LocalDate date(String field, JsonNode value) {
        ParsedDate parsed = dateParser.parse(text(field, value));
        if (!parsed.hasDate()) {
            throw new InvalidOracleResponseException(field + " is not a parseable date: '" + value.asText() + "'");
        }
        return parsed.date();
    }

    private static SeniorityTier seniority(JsonNode value) {
        String tier = text("seniority", value).toLowerCase(Locale.ROOT);
        for (SeniorityTier candidate : SeniorityTier.values()) {
            if (candidate.name().equalsIgnoreCase(tier) || candidate.getLabel().equalsIgnoreCase(tier)) {
                return candidate;
            }
        }
        throw new InvalidOracleResponseException("seniority is not a known tier: '" + tier + "'");
    }

    private static Integer years(JsonNode value) {
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new InvalidOracleResponseException("min_experience_years must be an integer");
        }
        return value.intValue();
    }
}
