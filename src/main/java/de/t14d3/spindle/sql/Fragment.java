package de.t14d3.spindle.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A piece of SQL text and the parameters its placeholders bind, in order.
 */
public record Fragment(String sql, List<Object> parameters) {
    public Fragment {
        parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
    }
}
