/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.api.v1alpha1;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import io.fabric8.kubernetes.api.model.KubernetesResource;

import io.storageaccessor.kubernetes.api.v1alpha1.accessorspec.ScopeSelector;

import edu.umd.cs.findbugs.annotations.Nullable;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "storageClassName", "namespaceSelector", "workspaceSelector" })
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(using = JsonDeserializer.None.class)
public class AccessorSpec implements KubernetesResource {

    @JsonProperty("storageClassName")
    private String storageClassName;

    @JsonProperty("namespaceSelector")
    private ScopeSelector namespaceSelector;

    @JsonProperty("workspaceSelector")
    private ScopeSelector workspaceSelector;

    public AccessorSpec() {
    }

    public AccessorSpec(String storageClassName, @Nullable ScopeSelector namespaceSelector, @Nullable ScopeSelector workspaceSelector) {
        this.storageClassName = storageClassName;
        this.namespaceSelector = namespaceSelector;
        this.workspaceSelector = workspaceSelector;
    }

    @Nullable
    public String getStorageClassName() {
        return storageClassName;
    }

    public void setStorageClassName(String storageClassName) {
        this.storageClassName = storageClassName;
    }

    @Nullable
    public ScopeSelector getNamespaceSelector() {
        return namespaceSelector;
    }

    public void setNamespaceSelector(ScopeSelector namespaceSelector) {
        this.namespaceSelector = namespaceSelector;
    }

    @Nullable
    public ScopeSelector getWorkspaceSelector() {
        return workspaceSelector;
    }

    public void setWorkspaceSelector(ScopeSelector workspaceSelector) {
        this.workspaceSelector = workspaceSelector;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AccessorSpec that = (AccessorSpec) o;
        return Objects.equals(storageClassName, that.storageClassName)
                && Objects.equals(namespaceSelector, that.namespaceSelector)
                && Objects.equals(workspaceSelector, that.workspaceSelector);
    }

    @Override
    public int hashCode() {
        return Objects.hash(storageClassName, namespaceSelector, workspaceSelector);
    }

    @Override
    public String toString() {
        return "AccessorSpec{storageClassName=" + storageClassName
                + ", namespaceSelector=" + namespaceSelector
                + ", workspaceSelector=" + workspaceSelector + "}";
    }
}
