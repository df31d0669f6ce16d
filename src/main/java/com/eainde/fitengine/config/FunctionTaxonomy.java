package com.eainde.fitengine.config;

import com.eainde.fitengine.model.JobFunction;
import com.eainde.fitengine.model.MismatchSeverity;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Role taxonomy: title and responsibility keywords per function, plus known adjacencies.
 *
 * <p>Pairs missing from the adjacency table are complete mismatches.</p>
 */
public final class FunctionTaxonomy {

    public record Definition(List<String> titles, List<String> signals) {
        public Definition {
            titles = List.copyOf(titles);
            signals = List.copyOf(signals);
        }
    }

    public record Adjacency(MismatchSeverity severity, List<String> transferable) {
        public Adjacency {
            transferable = List.copyOf(transferable);
        }
    }

    private final Map<JobFunction, Definition> definitions;
    private final Map<Pair, Adjacency> adjacency;

    private FunctionTaxonomy(Map<JobFunction, Definition> definitions, Map<Pair, Adjacency> adjacency) {
        this.definitions = Collections.unmodifiableMap(new EnumMap<>(definitions));
        this.adjacency = Map.copyOf(adjacency);
    }

    public Map<JobFunction, Definition> definitions() {
        return definitions;
    }

    /**
     * Severity and transferable skills for a candidate/role function pair, in either direction.
     */
    public Adjacency adjacencyOf(JobFunction candidate, JobFunction role) {
        if (candidate == role || candidate == JobFunction.OTHER || role == JobFunction.OTHER) {
            return new Adjacency(MismatchSeverity.NONE, List.of());
        }
        Adjacency known = adjacency.get(new Pair(candidate, role));
        if (known == null) {
            known = adjacency.get(new Pair(role, candidate));
        }
        return known != null ? known : new Adjacency(MismatchSeverity.COMPLETE, List.of());
    }

    public static FunctionTaxonomy defaults() {
        Map<JobFunction, Definition> defs = new EnumMap<>(JobFunction.class);
        defs.put(JobFunction.PRODUCT_MANAGEMENT, new Definition(
                List.of("product manager", "senior product manager", "staff product manager",
                        "principal product manager", "group product manager", "director of product",
                        "vp product", "chief product officer", "associate product manager",
                        "product lead", "product owner", "head of product"),
                List.of("roadmap", "product strategy", "user research", "feature prioritization",
                        "product requirements", "prd", "product vision", "customer discovery",
                        "product-market fit", "backlog", "product analytics", "a/b testing",
                        "experimentation", "product metrics", "product discovery")));
        defs.put(JobFunction.PROGRAM_MANAGEMENT, new Definition(
                List.of("program manager", "technical program manager", "tpm", "program director",
                        "portfolio manager", "delivery manager", "release manager", "launch manager",
                        "head of programs"),
                List.of("portfolio", "program delivery", "cross-functional coordination",
                        "executive reporting", "milestone tracking", "dependency management",
                        "risk management", "delivery cadence", "program governance", "workstream")));
        defs.put(JobFunction.PROJECT_MANAGEMENT, new Definition(
                List.of("project manager", "senior project manager", "it project manager",
                        "technical project manager", "project coordinator", "pmo", "project lead"),
                List.of("project plan", "gantt", "project timeline", "resource allocation",
                        "project budget", "scope management", "deliverables", "project schedule",
                        "milestone", "prince2", "waterfall")));
        defs.put(JobFunction.ENGINEERING, new Definition(
                List.of("software engineer", "senior engineer", "staff engineer", "principal engineer",
                        "tech lead", "architect", "sre", "devops", "data engineer", "backend engineer",
                        "frontend engineer", "fullstack engineer", "mobile engineer", "platform engineer",
                        "developer"),
                List.of("code", "architecture", "system design", "technical debt", "code review",
                        "deployment", "infrastructure", "api design", "programming",
                        "software development", "ci/cd", "microservices")));
        defs.put(JobFunction.ENGINEERING_MANAGEMENT, new Definition(
                List.of("engineering manager", "senior engineering manager", "director of engineering",
                        "vp engineering", "vp of engineering", "head of engineering", "tech lead manager",
                        "chief technology officer", "cto"),
                List.of("team leadership", "hiring engineers", "performance reviews", "technical roadmap",
                        "engineering culture", "team scaling", "engineering organization", "tech strategy")));
        defs.put(JobFunction.DATA_ANALYTICS, new Definition(
                List.of("data analyst", "senior data analyst", "analytics manager", "business intelligence",
                        "bi analyst", "data scientist", "analytics engineer", "head of analytics",
                        "director of analytics"),
                List.of("sql", "dashboards", "data modeling", "tableau", "looker", "reporting",
                        "insights", "kpis", "data visualization", "statistical analysis")));
        defs.put(JobFunction.STRATEGY_OPERATIONS, new Definition(
                List.of("strategy manager", "chief of staff", "business operations", "strategy and operations",
                        "corporate strategy", "strategic planning", "director of strategy", "biz ops"),
                List.of("strategic planning", "business cases", "market analysis", "competitive intelligence",
                        "operating model", "org design", "executive enablement", "operating rhythm",
                        "strategic initiatives")));
        defs.put(JobFunction.OPERATIONS, new Definition(
                List.of("operations manager", "operations director", "director of operations",
                        "head of operations", "operations lead", "supply chain manager", "logistics manager",
                        "warehouse manager", "fulfillment manager", "plant manager", "vp operations"),
                List.of("supply chain", "logistics", "fulfillment", "warehouse", "inventory", "procurement",
                        "vendor management", "throughput", "on-time delivery", "distribution center",
                        "lean", "six sigma", "sla compliance")));
        defs.put(JobFunction.MARKETING, new Definition(
                List.of("marketing manager", "product marketing manager", "pmm", "growth marketing",
                        "brand manager", "director of marketing", "vp marketing", "cmo",
                        "content marketing", "demand generation"),
                List.of("campaigns", "brand", "messaging", "positioning", "go-to-market",
                        "demand generation", "content strategy", "marketing analytics",
                        "lead generation", "marketing funnel")));
        defs.put(JobFunction.SALES, new Definition(
                List.of("account executive", "sales manager", "sales director", "business development",
                        "enterprise sales", "vp sales", "sales representative", "sdr", "bdr"),
                List.of("quota", "pipeline", "deal closing", "sales cycle", "revenue target",
                        "client acquisition", "account management", "sales process", "crm", "salesforce")));
        defs.put(JobFunction.RECRUITING, new Definition(
                List.of("recruiter", "talent acquisition", "senior recruiter", "recruiting manager",
                        "head of talent", "talent partner", "sourcer", "recruiting coordinator"),
                List.of("hiring", "candidates", "interview process", "offer management", "talent pipeline",
                        "employer brand", "recruiting metrics", "sourcing", "ats", "greenhouse")));
        defs.put(JobFunction.DESIGN, new Definition(
                List.of("product designer", "ux designer", "ui designer", "design lead", "head of design",
                        "ux researcher", "design manager", "senior designer", "principal designer",
                        "design director"),
                List.of("user experience", "wireframes", "prototypes", "design systems", "user testing",
                        "figma", "interaction design", "visual design", "usability", "design thinking")));
        defs.put(JobFunction.FINANCE, new Definition(
                List.of("financial analyst", "fp&a", "controller", "cfo", "finance manager",
                        "accounting manager", "finops", "finance director", "treasurer"),
                List.of("financial modeling", "budgeting", "forecasting", "p&l", "cost analysis",
                        "financial reporting", "variance analysis", "financial planning", "accounting")));
        defs.put(JobFunction.CUSTOMER_SUCCESS, new Definition(
                List.of("customer success manager", "account manager", "client success",
                        "customer success director", "head of cs"),
                List.of("customer health", "nrr", "churn", "renewal", "onboarding",
                        "customer retention", "customer satisfaction", "nps")));
        defs.put(JobFunction.HUMAN_RESOURCES, new Definition(
                List.of("hr manager", "hr business partner", "hrbp", "people operations", "head of hr",
                        "chief people officer", "hr director"),
                List.of("employee relations", "compensation", "benefits", "performance management",
                        "people strategy", "hr policy", "workforce planning")));

        Map<Pair, Adjacency> adj = new HashMap<>();
        adjacent(adj, JobFunction.PRODUCT_MANAGEMENT, JobFunction.PROGRAM_MANAGEMENT, MismatchSeverity.ADJACENT,
                "cross-functional leadership", "stakeholder management", "roadmap thinking");
        adjacent(adj, JobFunction.PRODUCT_MANAGEMENT, JobFunction.PROJECT_MANAGEMENT, MismatchSeverity.ADJACENT,
                "project execution", "stakeholder communication", "timeline management");
        adjacent(adj, JobFunction.PROGRAM_MANAGEMENT, JobFunction.PROJECT_MANAGEMENT, MismatchSeverity.ADJACENT,
                "delivery management", "stakeholder reporting", "timeline management");
        adjacent(adj, JobFunction.PRODUCT_MANAGEMENT, JobFunction.STRATEGY_OPERATIONS, MismatchSeverity.ADJACENT,
                "strategic thinking", "cross-functional work", "data-driven decisions");
        adjacent(adj, JobFunction.ENGINEERING_MANAGEMENT, JobFunction.PROGRAM_MANAGEMENT, MismatchSeverity.ADJACENT,
                "technical credibility", "delivery management", "team coordination");
        adjacent(adj, JobFunction.ENGINEERING_MANAGEMENT, JobFunction.ENGINEERING, MismatchSeverity.ADJACENT,
                "technical depth", "system design", "code review");
        adjacent(adj, JobFunction.DATA_ANALYTICS, JobFunction.PRODUCT_MANAGEMENT, MismatchSeverity.SIGNIFICANT,
                "data-driven thinking", "metrics definition", "analytical rigor");
        adjacent(adj, JobFunction.MARKETING, JobFunction.PRODUCT_MANAGEMENT, MismatchSeverity.SIGNIFICANT,
                "customer understanding", "go-to-market", "messaging");
        adjacent(adj, JobFunction.SALES, JobFunction.PRODUCT_MANAGEMENT, MismatchSeverity.SIGNIFICANT,
                "customer conversations", "market feedback", "business acumen");
        adjacent(adj, JobFunction.DESIGN, JobFunction.PRODUCT_MANAGEMENT, MismatchSeverity.ADJACENT,
                "user empathy", "customer research", "collaboration with engineering");
        adjacent(adj, JobFunction.FINANCE, JobFunction.STRATEGY_OPERATIONS, MismatchSeverity.ADJACENT,
                "financial modeling", "business analysis", "executive reporting");
        adjacent(adj, JobFunction.CUSTOMER_SUCCESS, JobFunction.PRODUCT_MANAGEMENT, MismatchSeverity.SIGNIFICANT,
                "customer empathy", "feedback loops", "product input");
        adjacent(adj, JobFunction.ENGINEERING, JobFunction.PRODUCT_MANAGEMENT, MismatchSeverity.ADJACENT,
                "technical depth", "engineering collaboration", "system thinking");
        adjacent(adj, JobFunction.PROGRAM_MANAGEMENT, JobFunction.ENGINEERING_MANAGEMENT, MismatchSeverity.SIGNIFICANT,
                "delivery management", "cross-functional coordination");
        adjacent(adj, JobFunction.SALES, JobFunction.CUSTOMER_SUCCESS, MismatchSeverity.ADJACENT,
                "client relationships", "account management", "revenue focus");
        adjacent(adj, JobFunction.MARKETING, JobFunction.SALES, MismatchSeverity.ADJACENT,
                "market understanding", "customer messaging", "pipeline contribution");
        adjacent(adj, JobFunction.OPERATIONS, JobFunction.STRATEGY_OPERATIONS, MismatchSeverity.ADJACENT,
                "operating rhythm", "process design", "vendor management");
        adjacent(adj, JobFunction.OPERATIONS, JobFunction.PROGRAM_MANAGEMENT, MismatchSeverity.SIGNIFICANT,
                "delivery management", "process design");
        return new FunctionTaxonomy(defs, adj);
    }

    private static void adjacent(Map<Pair, Adjacency> adj, JobFunction a, JobFunction b,
                                 MismatchSeverity severity, String... transferable) {
        adj.put(new Pair(a, b), new Adjacency(severity, List.of(transferable)));
    }

    private record Pair(JobFunction candidate, JobFunction role) {
    }
}
