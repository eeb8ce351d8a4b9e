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
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import io.fabric8.kubernetes.api.model.KubernetesResource;

/**
 * Field expressions that must all hold.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(using = JsonDeserializer.None.class)
public class FieldRuleGroup implements KubernetesResource {

    @JsonProperty("fieldExpressions")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<FieldExpression> fieldExpressions = new ArrayList<>();

    public FieldRuleGroup() {
    }

    public FieldRuleGroup(List<FieldExpression> fieldExpressions) {
        this.fieldExpressions = new ArrayList<>(fieldExpressions);
    }

    public static FieldRuleGroup allOf(FieldExpression... expressions) {
        return new FieldRuleGroup(List.of(expressions));
    }

    public List<FieldExpression> getFieldExpressions() {
        return fieldExpressions;
    }

    public void setFieldExpressions(List<FieldExpression> fieldExpressions) {
        this.fieldExpressions = fieldExpressions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Objects.equals(fieldExpressions, ((FieldRuleGroup) o).fieldExpressions);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(fieldExpressions);
    }

    @Override
    public String toString() {
        return "FieldRuleGroup{fieldExpressions=" + fieldExpressions + "}";
    }
}
