/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.api.tenant.v1alpha1;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import io.fabric8.kubernetes.api.model.KubernetesResource;

import edu.umd.cs.findbugs.annotations.Nullable;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(using = JsonDeserializer.None.class)
public class WorkspaceSpec implements KubernetesResource {

    @JsonProperty("manager")
    private String manager;

    @JsonProperty("networkIsolation")
    private Boolean networkIsolation;

    @Nullable
    public String getManager() {
        return manager;
    }

    public void setManager(String manager) {
        this.manager = manager;
    }

    @Nullable
    public Boolean getNetworkIsolation() {
        return networkIsolation;
    }

    public void setNetworkIsolation(Boolean networkIsolation) {
        this.networkIsolation = networkIsolation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        WorkspaceSpec that = (WorkspaceSpec) o;
        return Objects.equals(manager, that.manager) && Objects.equals(networkIsolation, that.networkIsolation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(manager, networkIsolation);
    }
}
