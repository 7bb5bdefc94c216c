package sml.wsv;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * One non-blank source line. A {@code null} entry in {@code values} is an explicit null ({@code -}).
 */
@Data
@AllArgsConstructor
public class WsvRow {
    private int line;
    private List<String> values;

    public int size() {
        return values.size();
    }

    public String get(int index) {
        return values.get(index);
    }
}
