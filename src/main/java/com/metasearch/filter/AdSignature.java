package com.metasearch.filter;

import java.util.regex.Pattern;

public record AdSignature(AdCategory category, Pattern pattern) {

    static AdSignature of(AdCategory category, String regex) {
        return new AdSignature(category, Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
    }

    public boolean matches(String url) {
        return pattern.matcher(url).find();
    }
}
