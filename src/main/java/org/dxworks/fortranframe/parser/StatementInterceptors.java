package org.dxworks.fortranframe.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

public final class StatementInterceptors {

    private StatementInterceptors() {}

    /** Discards every statement matching the regex (case-insensitive, whole statement). */
    public static StatementInterceptor discarding(String regex) {
        Pattern pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        return (text, origin) -> pattern.matcher(text).matches();
    }

    /** {@code contains} and {@code sequence} carry no structure the tree needs. */
    public static List<StatementInterceptor> defaults() {
        return List.of(
                discarding("^contains$"),
                discarding("^sequence$"));
    }

    public static List<StatementInterceptor> defaultsPlus(List<String> discardRegexes) {
        List<StatementInterceptor> interceptors = new ArrayList<>(defaults());
        for (String regex : discardRegexes) {
            interceptors.add(discarding(regex));
        }
        return interceptors;
    }
}
