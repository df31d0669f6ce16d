package com.eainde.fitengine.model;

import java.util.regex.Pattern;

/**
 * Topics whose sentences must come from canonical statements and never from the text provider.
 */
public enum SensitiveTopic {
    TITLE_INFLATION(Pattern.compile("\\b(inflat\\w*|overstat\\w*|title (is |isn't |is not )?(not )?supported)", Pattern.CASE_INSENSITIVE)),
    CREDIBILITY(Pattern.compile("\\b(credib\\w*|fabricat\\w*|implausib\\w*|misrepresent\\w*)", Pattern.CASE_INSENSITIVE)),
    FUNCTION_MISMATCH(Pattern.compile("\\b(function(al)? mismatch|different function|not a \\w+( \\w+)? role)", Pattern.CASE_INSENSITIVE)),
    DOMAIN_TRANSLATION(Pattern.compile("\\b(translat\\w*|transfers? (directly |well )?to|directly applicable)", Pattern.CASE_INSENSITIVE)),
    ELIGIBILITY(Pattern.compile("\\b(eligib\\w*|disqualif\\w*)", Pattern.CASE_INSENSITIVE));

    private final Pattern marker;

    SensitiveTopic(Pattern marker) {
        this.marker = marker;
    }

    public boolean isTouchedBy(String sentence) {
        return sentence != null && marker.matcher(sentence).find();
    }
}
