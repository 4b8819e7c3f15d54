package com.infomedia.abacox.cdrexception.component.configmanager;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Data
@AllArgsConstructor
public class Value {

    private String key;

    private String value;

    private String getErrorMessage(String targetType) {
        return String.format("Configuration value '%s' for key '%s' cannot be converted to %s.", value, key, targetType);
    }

    public Integer asInteger() {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(getErrorMessage("Integer"), e);
        }
    }

    public BigDecimal asBigDecimal() {
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(getErrorMessage("BigDecimal"), e);
        }
    }

    public String asString() {
        return value;
    }

    public List<String> asStringList() {
        return asStringList(",");
    }

    public List<String> asStringList(String delimiter) {
        if (value == null || value.trim().isEmpty()) {
            return Collections.emptyList();
        }
        return Arrays.stream(value.split(delimiter))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    public Set<Integer> asIntegerSet() {
        try {
            return asStringList().stream()
                    .map(Integer::parseInt)
                    .collect(Collectors.toCollection(LinkedHashSet::new));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(getErrorMessage("a list of integers"), e);
        }
    }
}
