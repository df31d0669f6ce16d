package com.eainde.fitengine.model;

import java.util.List;
import java.util.Locale;

/**
 * Job description as received with the analysis request.
 *
 * @param company             hiring company
 * @param roleTitle           advertised title
 * @param body                full description text
 * @param requiredCredentials credentials the posting lists as mandatory
 * @param statedLevel         level supplied by the caller, null to infer from the text
 */
public record JobDescription(
        String company,
        String roleTitle,
        String body,
        List<String> requiredCredentials,
        SeniorityLevel statedLevel
) {

    public JobDescription {
        company = company == null ? "" : company;
        roleTitle = roleTitle == null ? "" : roleTitle.trim();
        body = body == null ? "" : body;
        requiredCredentials = requiredCredentials == null ? List.of() : List.copyOf(requiredCredentials);
    }

    public boolean isBlank() {
        return roleTitle.isBlank() && body.isBlank();
    }

    public String searchableText() {
        return (roleTitle + "\n" + body).toLowerCase(Locale.ROOT);
    }
}
