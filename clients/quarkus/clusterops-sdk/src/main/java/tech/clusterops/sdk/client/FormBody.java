package tech.clusterops.sdk.client;

import tech.clusterops.sdk.support.UrlEncoding;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@code application/x-www-form-urlencoded} request body. Keys keep insertion order; null
 * values and empty lists are skipped so unset fields leave the server value alone.
 */
public class FormBody {

    private final List<String[]> fields = new ArrayList<>();

    public static FormBody create() {
        return new FormBody();
    }

    public FormBody add(String key, Object value) {
        if (value != null) {
            fields.add(new String[] {key, String.valueOf(value)});
        }
        return this;
    }

    /**
     * Add a list as one comma-separated value.
     */
    public FormBody addJoined(String key, List<String> values) {
        if (values != null && !values.isEmpty()) {
            fields.add(new String[] {key, String.join(",", values)});
        }
        return this;
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public String encode() {
        return fields.stream()
            .map(f -> UrlEncoding.formValue(f[0]) + "=" + UrlEncoding.formValue(f[1]))
            .collect(Collectors.joining("&"));
    }

    /**
     * Field names only; values may hold secrets.
     */
    @Override
    public String toString() {
        return "FormBody" + fields.stream().map(f -> f[0]).collect(Collectors.toList());
    }
}
