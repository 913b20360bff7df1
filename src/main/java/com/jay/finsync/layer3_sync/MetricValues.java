package com.jay.finsync.layer3_sync;

import org.springframework.beans.BeanWrapper;
import org.springframework.beans.BeanWrapperImpl;

import java.beans.PropertyDescriptor;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Flattens a stored metrics row into the snake_case keyed map the health layout refers to,
 * e.g. returnOnEquity becomes return_on_equity. Only non-null numeric properties are kept.
 */
final class MetricValues {

    private static final Set<String> NOT_METRICS = Set.of("id", "companyId");

    private MetricValues() {}

    static Map<String, Object> of(Object row) {
        Map<String, Object> values = new LinkedHashMap<>();
        if (row == null) return values;
        BeanWrapper bean = new BeanWrapperImpl(row);
        for (PropertyDescriptor property : bean.getPropertyDescriptors()) {
            Class<?> type = property.getPropertyType();
            if (type == null || property.getReadMethod() == null) continue;
            if (!Number.class.isAssignableFrom(type) || NOT_METRICS.contains(property.getName())) continue;
            Object value = bean.getPropertyValue(property.getName());
            if (value != null) {
                values.put(snakeCase(property.getName()), value);
            }
        }
        return values;
    }

    static String snakeCase(String camel) {
        StringBuilder sb = new StringBuilder(camel.length() + 8);
        for (char c : camel.toCharArray()) {
            if (Character.isUpperCase(c)) {
                sb.append('_').append(Character.toLowerCase(c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
