/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.api.v1alpha1.accessorspec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import io.fabric8.kubernetes.api.model.KubernetesResource;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Tests one well known field of an object, {@code name} or {@code status}.
 */
@JsonPropertyOrder({ "field", "operator", "values" })
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(using = JsonDeserializer.None.class)
public class FieldExpression implements KubernetesResource {

    @JsonProperty("field")
    private String field;

    @JsonProperty("operator")
    private String operator;

    @JsonProperty("values")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<String> values = new ArrayList<>();

    public FieldExpression() {
    }

    public FieldExpression(String field, String operator, List<String> values) {
        this.field = field;
        this.operator = operator;
        this.values = new ArrayList<>(values);
    }

    public static FieldExpression in(String field, String... values) {
        return new FieldExpression(field, "In", List.of(values));
    }

    public static FieldExpression notIn(String field, String... values) {
        return new FieldExpression(field, "NotIn", List.of(values));
    }

    @Nullable
    public String getField() {
        return field;
    }

    public void setField(String field) {
        this.field = field;
    }

    /**
     * @return the operator as authored, {@code In} and {@code NotIn} are the only ones with an effect
     */
    @Nullable
    public String getOperator() {
        return operator;
    }

    public void setOperator(String operator) {
        this.operator = operator;
    }

    public List<String> getValues() {
        return values;
    }

    public void setValues(List<String> values) {
        this.values = values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        FieldExpression that = (FieldExpression) o;
        return Objects.equals(field, that.field) && Objects.equals(operator, that.operator) && Objects.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, operator, values);
    }

    @Override
    public String toString() {
        return "FieldExpression{field=" + field + ", operator=" + operator + ", values=" + values + "}";
    }
}
