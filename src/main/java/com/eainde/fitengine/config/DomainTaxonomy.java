package com.eainde.fitengine.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Industry domains and which domains count as adjacent for translation claims.
 */
public record DomainTaxonomy(Map<String, List<String>> keywords, Map<String, Set<String>> adjacent, int minimumMatches) {

    public DomainTaxonomy {
        Map<String, List<String>> kw = new LinkedHashMap<>();
        keywords.forEach((k, v) -> kw.put(k, List.copyOf(v)));
        keywords = Collections.unmodifiableMap(kw);
        Map<String, Set<String>> adj = new LinkedHashMap<>();
        adjacent.forEach((k, v) -> adj.put(k, Set.copyOf(v)));
        adjacent = Collections.unmodifiableMap(adj);
    }

    public boolean areAdjacent(String candidateDomain, String targetDomain) {
        return adjacent.getOrDefault(candidateDomain, Set.of()).contains(targetDomain)
                || adjacent.getOrDefault(targetDomain, Set.of()).contains(candidateDomain);
    }

    public static DomainTaxonomy defaults() {
        Map<String, List<String>> kw = new LinkedHashMap<>();
        kw.put("b2b_saas", List.of("saas", "b2b", "enterprise software", "subscription", "recurring revenue",
                "enterprise sales", "sales cycle", "enterprise customer", "b2b sales"));
        kw.put("messaging", List.of("messaging", "notifications", "push notifications", "email infrastructure",
                "sms", "communications platform", "messaging infrastructure", "in-app messaging", "twilio",
                "sendgrid", "braze"));
        kw.put("fintech", List.of("fintech", "payments", "banking", "financial services", "lending", "credit",
                "transactions", "payment processing", "stripe", "checkout", "billing", "invoicing"));
        kw.put("adtech", List.of("advertising", "adtech", "programmatic", "rtb", "dsp", "ssp", "ad exchange",
                "media buying", "ad serving", "attribution", "martech"));
        kw.put("ecommerce", List.of("ecommerce", "e-commerce", "retail", "marketplace", "shopping", "cart",
                "checkout", "product catalog", "inventory", "fulfillment", "shopify"));
        kw.put("healthcare", List.of("healthcare", "health tech", "clinical", "ehr", "emr", "hipaa", "patient",
                "telemedicine", "telehealth", "medical"));
        kw.put("developer_tools", List.of("developer tools", "devtools", "api", "sdk", "infrastructure",
                "developer platform", "developer experience", "ci/cd", "deployment", "cloud infrastructure"));
        kw.put("data_analytics", List.of("analytics", "data platform", "data infrastructure",
                "business intelligence", "data warehouse", "etl", "data pipeline", "ml platform", "data science"));
        kw.put("security", List.of("security", "cybersecurity", "infosec", "identity", "authentication",
                "authorization", "iam", "sso", "encryption", "compliance"));
        kw.put("consumer", List.of("consumer", "b2c", "social", "content", "media", "entertainment", "gaming",
                "mobile app", "consumer app"));
        kw.put("logistics", List.of("logistics", "supply chain", "warehouse", "freight", "distribution center",
                "last mile", "shipping", "procurement"));

        Map<String, Set<String>> adj = new LinkedHashMap<>();
        adj.put("b2b_saas", Set.of("developer_tools", "data_analytics"));
        adj.put("messaging", Set.of("b2b_saas", "adtech", "ecommerce"));
        adj.put("fintech", Set.of("ecommerce", "b2b_saas", "security"));
        adj.put("adtech", Set.of("messaging", "data_analytics", "ecommerce"));
        adj.put("ecommerce", Set.of("fintech", "consumer", "messaging", "logistics"));
        adj.put("healthcare", Set.of("b2b_saas", "security"));
        adj.put("developer_tools", Set.of("b2b_saas", "data_analytics", "security"));
        adj.put("data_analytics", Set.of("b2b_saas", "developer_tools", "adtech"));
        adj.put("security", Set.of("developer_tools", "fintech", "healthcare"));
        adj.put("consumer", Set.of("ecommerce", "adtech"));
        adj.put("logistics", Set.of("ecommerce"));
        return new DomainTaxonomy(kw, adj, 2);
    }
}
