package objectsdb.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parameterized SQL text: {@code ?} placeholders in {@code text}, bound in order from {@code params}.
 */
public record SqlFragment(String text, List<Object> params) {

    public SqlFragment {
        params = Collections.unmodifiableList(new ArrayList<>(params));
    }

    public static SqlFragment empty() {
        return new SqlFragment("", List.of());
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }
}
