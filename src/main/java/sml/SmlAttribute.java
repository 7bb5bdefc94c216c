package sml;

import lombok.Data;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A named row of values. Values may be {@code null}, which is distinct from the empty string.
 */
@Data
public class SmlAttribute {

    @NonNull
    private String name;
    @NonNull
    private List<String> values;

    public SmlAttribute(@NonNull String name, String... values) {
        this(name, Arrays.asList(values));
    }

    public SmlAttribute(@NonNull String name, @NonNull List<String> values) {
        this.name = name;
        this.values = new ArrayList<>(values);
    }
}
