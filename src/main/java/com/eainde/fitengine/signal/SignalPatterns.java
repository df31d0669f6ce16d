package com.eainde.fitengine.signal;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Claim and evidence patterns shared by the extractor and the title inflation check.
 *
 * <p>Claim patterns say what a bullet asserts. Evidence patterns say whether the bullet proves
 * it: numbers, money, user counts, or ownership of a bounded system under real load.
 * Activity nouns and titles alone never count as evidence.</p>
 */
public final class SignalPatterns {

    private SignalPatterns() {
    }

    // =========================================================================
    //  Claims
    // =========================================================================

    static final Pattern SCOPE_CLAIM = ci("\\b(team|teams|budget|users|customers|revenue|countries|markets|regions"
            + "|platform|system|infrastructure|pipeline|org|organization|p&l|company-wide|global|portfolio)\\b");

    static final Pattern LEADERSHIP_CLAIM = ci("\\b(led|lead|leading|managed|manage|managing|oversaw|hired|mentored"
            + "|directed|headed|supervised|coached)\\b");

    static final Pattern OWNERSHIP_CLAIM = ci("\\b(owned|led|defined|built|shipped|launched|architected|designed"
            + "|established|created|drove|spearheaded|pioneered|founded|orchestrated|decided|accountable|implemented"
            + "|developed|migrated|automated)\\b");

    // =========================================================================
    //  Evidence
    // =========================================================================

    private static final List<Pattern> QUANTIFIED_SCALE = List.of(
            ci("\\b(\\d+)[\\-\\s]*(person|people|engineer|member|report|team|direct)"),
            ci("\\$[\\d,\\.]+\\s*[MBK]?(?:\\s|$|\\b)"),
            ci("\\b[\\d,\\.]+\\s*[MBK]\\s*(budget|revenue|ARR|GMV|pipeline)"),
            ci("\\b\\d+[MKB]?\\+?\\s*(users|customers|MAU|DAU|accounts|subscribers)"),
            ci("\\b\\d+\\s*(countries|markets|regions|offices|locations|sites|warehouses)"),
            ci("\\b\\d+[MKB]?\\+?\\s*(requests|transactions|orders|calls|shipments)"));

    private static final List<Pattern> SYSTEM_OWNERSHIP = List.of(
            ci("\\b(?:owned|built|architected|designed|created)\\s+(?:the\\s+)?(?:\\w+\\s+){0,2}"
                    + "(?:engine|infrastructure|platform|system|pipeline|service|api|framework)"),
            ci("\\b(?:owned|led)\\s+(?:the\\s+)?(?:entire|full|end-to-end)\\s+\\w+"),
            ci("\\bsole\\s+(?:owner|architect|engineer)"),
            ci("\\bfrom\\s+(?:scratch|zero|ground\\s+up)"));

    private static final List<Pattern> COMPLEXITY = List.of(
            ci("\\bserving\\s+\\d+"),
            ci("\\bprocessing\\s+[\\$\\d]"),
            ci("\\bhandling\\s+\\d+"),
            ci("\\bscaling\\s+(?:to|from)"),
            ci("\\b\\d+\\s*(?:ms|millisecond|latency)"),
            ci("\\b(?:99|99\\.9|99\\.99)%?\\s*(?:uptime|availability|SLA)"),
            ci("\\bhigh[\\-\\s]?(?:availability|throughput|performance)"),
            ci("\\bdistributed\\b"),
            ci("\\bmicroservices?\\b"),
            ci("\\breal[\\-\\s]?time\\b"),
            ci("\\bproduction\\s+(?:system|traffic|load)"));

    private static final List<Pattern> LEADERSHIP_WITH_NUMBERS = List.of(
            ci("\\b(?:led|managed|oversaw)\\s+(?:a\\s+)?(?:team\\s+of\\s+)?\\d+"),
            ci("\\b(?:led|managed|oversaw)\\s+(?:a|the)?\\s*\\d+[\\-\\s]*(person|people|member|engineer|report)"),
            ci("\\b(?:led|managed|oversaw)\\s+(?:\\w+\\s+){0,3}team\\s+of\\s+\\d+"),
            ci("\\bhired\\s+\\d+"),
            ci("\\bbuilt\\s+(?:a\\s+)?team\\s+(?:of\\s+)?\\d+"),
            ci("\\b\\d+\\s*direct\\s*reports?\\b"),
            ci("\\bmentored\\s+\\d+"),
            ci("\\bgrew\\s+(?:the\\s+)?(?:team|org)\\s+(?:from\\s+)?\\d+"),
            ci("\\bteam\\s+of\\s+\\d+"),
            ci("\\borg(?:anization)?\\s+of\\s+\\d+"),
            ci("\\b\\d+[\\-\\s]*(?:person|people|member|head)\\s+(?:team|org|department|group)"));

    private static final List<Pattern> LEADERSHIP_WITH_BUDGET = List.of(
            ci("\\b(?:owned|managed)\\s+(?:a\\s+)?\\$[\\d,\\.]+"),
            ci("\\bp&l\\s*(?:of|for)?\\s*\\$[\\d,\\.]+"),
            ci("\\bbudget\\s*(?:of|for)?\\s*\\$[\\d,\\.]+"),
            ci("\\bresponsible\\s+for\\s+\\$[\\d,\\.]+"));

    private static final Pattern CONTRIBUTOR = ci("\\b(supported|helped|assisted|contributed|participated"
            + "|involved in|worked on|exposed to)\\b");

    private static final Pattern METRIC = Pattern.compile("\\d+%|\\$[\\d,\\.]+|[\\d\\.]+x\\b|\\d+[MKB]\\b");

    private static final Pattern CONSEQUENCE = ci("\\b(resulting|saving|driving|enabling|reducing|increasing"
            + "|generating|delivering|achieving|grew|reduced|increased|improved|accelerated|cut|lowered"
            + "|which led to|leading to)\\b");

    private static final Pattern STRATEGIC = ci("\\b(strategy|strategic|roadmap|vision|p&l|company-wide|org-wide)\\b"
            + "|\\bbudget.*\\$");

    // =========================================================================
    //  Checks
    // =========================================================================

    public static boolean hasScopeEvidence(String text) {
        if (isBlank(text)) {
            return false;
        }
        if (anyMatch(QUANTIFIED_SCALE, text)) {
            return true;
        }
        return anyMatch(SYSTEM_OWNERSHIP, text) && anyMatch(COMPLEXITY, text);
    }

    public static boolean hasLeadershipEvidence(String text) {
        return !isBlank(text) && (anyMatch(LEADERSHIP_WITH_NUMBERS, text) || anyMatch(LEADERSHIP_WITH_BUDGET, text));
    }

    /**
     * Decision-maker language with no contributor hedging next to it.
     */
    public static boolean hasOwnership(String text) {
        return !isBlank(text) && OWNERSHIP_CLAIM.matcher(text).find() && !CONTRIBUTOR.matcher(text).find();
    }

    public static boolean hasImpact(String text) {
        return !isBlank(text) && METRIC.matcher(text).find() && CONSEQUENCE.matcher(text).find();
    }

    public static boolean hasComplexity(String text) {
        return !isBlank(text) && anyMatch(COMPLEXITY, text);
    }

    public static boolean hasStrategicEvidence(String text) {
        return !isBlank(text) && STRATEGIC.matcher(text).find();
    }

    public static boolean hasMetric(String text) {
        return !isBlank(text) && METRIC.matcher(text).find();
    }

    static boolean anyMatch(List<Pattern> patterns, String text) {
        for (Pattern p : patterns) {
            if (p.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    private static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }

    private static Pattern ci(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }
}
