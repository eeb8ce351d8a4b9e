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
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import io.fabric8.kubernetes.api.model.KubernetesResource;

/**
 * Selects namespaces or workspaces. The label rules and the field rules are two independent
 * selectors, and a target must satisfy both. Within each, a target satisfies the selector
 * when it satisfies any one of the rule groups.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({ "labelSelector", "fieldSelector" })
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(using = JsonDeserializer.None.class)
public class ScopeSelector implements KubernetesResource {

    @JsonProperty("labelSelector")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<LabelRuleGroup> labelSelector = new ArrayList<>();

    @JsonProperty("fieldSelector")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<FieldRuleGroup> fieldSelector = new ArrayList<>();

    public ScopeSelector() {
    }

    public ScopeSelector(List<LabelRuleGroup> labelSelector, List<FieldRuleGroup> fieldSelector) {
        this.labelSelector = new ArrayList<>(labelSelector);
        this.fieldSelector = new ArrayList<>(fieldSelector);
    }

    public static ScopeSelector labels(LabelRuleGroup... groups) {
        return new ScopeSelector(List.of(groups), List.of());
    }

    public static ScopeSelector fields(FieldRuleGroup... groups) {
        return new ScopeSelector(List.of(), List.of(groups));
    }

    public List<LabelRuleGroup> getLabelSelector() {
        return labelSelector;
    }

    public void setLabelSelector(List<LabelRuleGroup> labelSelector) {
        this.labelSelector = labelSelector;
    }

    public List<FieldRuleGroup> getFieldSelector() {
        return fieldSelector;
    }

    public void setFieldSelector(List<FieldRuleGroup> fieldSelector) {
        this.fieldSelector = fieldSelector;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ScopeSelector that = (ScopeSelector) o;
        return Objects.equals(labelSelector, that.labelSelector) && Objects.equals(fieldSelector, that.fieldSelector);
    }

    @Override
    public int hashCode() {
        return Objects.hash(labelSelector, fieldSelector);
    }

    @Override
    public String toString() {
        return "ScopeSelector{labelSelector=" + labelSelector + ", fieldSelector=" + fieldSelector + "}";
    }
}
