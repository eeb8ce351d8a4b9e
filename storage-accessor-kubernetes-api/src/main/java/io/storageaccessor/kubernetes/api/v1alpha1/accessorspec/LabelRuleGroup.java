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
 * Label expressions that must all hold.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(using = JsonDeserializer.None.class)
public class LabelRuleGroup implements KubernetesResource {

    @JsonProperty("matchExpressions")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<MatchExpression> matchExpressions = new ArrayList<>();

    public LabelRuleGroup() {
    }

    public LabelRuleGroup(List<MatchExpression> matchExpressions) {
        this.matchExpressions = new ArrayList<>(matchExpressions);
    }

    public static LabelRuleGroup allOf(MatchExpression... expressions) {
        return new LabelRuleGroup(List.of(expressions));
    }

    public List<MatchExpression> getMatchExpressions() {
        return matchExpressions;
    }

    public void setMatchExpressions(List<MatchExpression> matchExpressions) {
        this.matchExpressions = matchExpressions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Objects.equals(matchExpressions, ((LabelRuleGroup) o).matchExpressions);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(matchExpressions);
    }

    @Override
    public String toString() {
        return "LabelRuleGroup{matchExpressions=" + matchExpressions + "}";
    }
}
