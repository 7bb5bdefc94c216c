package sml;

import lombok.Data;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.List;

@Data
public class SmlElement {

    @NonNull
    private String name;
    @NonNull
    private List<SmlAttribute> attributes;

    public SmlElement(@NonNull String name) {
        this(name, new ArrayList<>());
    }

    public SmlElement(@NonNull String name, @NonNull List<SmlAttribute> attributes) {
        this.name = name;
        this.attributes = new ArrayList<>(attributes);
    }

    public SmlElement addAttribute(String name, String... values) {
        attributes.add(new SmlAttribute(name, values));
        return this;
    }
}
