package com.resume.network.rules;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in normalization rules for resume organizations, departments and titles.
 */
public final class DefaultNormalizationRules {

    private static final String SUFFIX_LEAD = "(?:,|\\s)\\s*";

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Creates a NormalizationEngine with all default rules.
     */
    public static NormalizationEngine createDefaultEngine() {
        List<NormalizationRule> rules = new ArrayList<>();
        rules.addAll(getOrganizationRules());
        rules.addAll(getDepartmentRules());
        rules.addAll(getTitleRules());
        rules.addAll(getCommonRules());
        return new NormalizationEngine(rules);
    }

    /**
     * Legal-suffix and article rules for organization names.
     */
    public static List<NormalizationRule> getOrganizationRules() {
        return List.of(
                legalSuffix("org-inc", "Inc\\.?|Incorporated"),
                legalSuffix("org-ltd", "Ltd\\.?|Limited"),
                legalSuffix("org-corp", "Corp\\.?|Corporation"),
                legalSuffix("org-co", "Co\\.?|Company"),
                legalSuffix("org-llc", "LLC|L\\.L\\.C\\.?"),
                legalSuffix("org-plc", "PLC|P\\.L\\.C\\.?"),
                legalSuffix("org-gmbh", "GmbH"),
                legalSuffix("org-ag", "AG"),
                legalSuffix("org-sa", "S\\.A\\.?|SA"),
                legalSuffix("org-nv", "N\\.V\\.?|NV"),
                legalSuffix("org-bv", "B\\.V\\.?|BV"),

                NormalizationRule.builder()
                        .name("org-the")
                        .pattern("^The\\s+")
                        .targets(NormalizationTarget.ORGANIZATION)
                        .priority(20)
                        .build()
        );
    }

    /**
     * Rules that strip "Dept."/"Department of"/"Team" decorations from department labels.
     */
    public static List<NormalizationRule> getDepartmentRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("dept-prefix")
                        .pattern("^(?:Dept\\.?|Department)\\s+(?:of\\s+)?")
                        .targets(NormalizationTarget.DEPARTMENT)
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("dept-suffix")
                        .pattern("\\s+(?:Dept\\.?|Department|Division|Team|Group)$")
                        .targets(NormalizationTarget.DEPARTMENT)
                        .priority(10)
                        .build()
        );
    }

    /**
     * Abbreviation expansion for role titles.
     */
    public static List<NormalizationRule> getTitleRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("title-sr")
                        .pattern("\\bSr\\.?(?=\\s|$)")
                        .replacement("Senior")
                        .targets(NormalizationTarget.TITLE)
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("title-jr")
                        .pattern("\\bJr\\.?(?=\\s|$)")
                        .replacement("Junior")
                        .targets(NormalizationTarget.TITLE)
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("title-mgr")
                        .pattern("\\bMgr\\.?(?=\\s|$)")
                        .replacement("Manager")
                        .targets(NormalizationTarget.TITLE)
                        .priority(10)
                        .build()
        );
    }

    /**
     * Rules that apply to every target.
     */
    public static List<NormalizationRule> getCommonRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("common-ampersand")
                        .pattern("\\s*&\\s*")
                        .replacement(" ")
                        .priority(50)
                        .build(),

                NormalizationRule.builder()
                        .name("common-and")
                        .pattern("\\s+and\\s+")
                        .replacement(" ")
                        .priority(50)
                        .build(),

                // Keep letters and digits in any script
                NormalizationRule.builder()
                        .name("common-special-chars")
                        .pattern("[^\\p{L}\\p{N}\\s]")
                        .replacement(" ")
                        .priority(100)
                        .build(),

                NormalizationRule.builder()
                        .name("common-collapse-spaces")
                        .pattern("\\s+")
                        .replacement(" ")
                        .priority(200)
                        .build()
        );
    }

    private static NormalizationRule legalSuffix(String name, String alternatives) {
        return NormalizationRule.builder()
                .name(name)
                .pattern(SUFFIX_LEAD + "(?:" + alternatives + ")$")
                .targets(NormalizationTarget.ORGANIZATION)
                .priority(10)
                .build();
    }
}
