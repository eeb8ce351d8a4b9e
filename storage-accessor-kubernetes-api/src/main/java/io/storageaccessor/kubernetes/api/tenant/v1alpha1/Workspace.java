/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.api.tenant.v1alpha1;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.Singular;
import io.fabric8.kubernetes.model.annotation.Version;

/**
 * A cluster scoped grouping of namespaces. Namespaces refer to their workspace by label.
 */
@Group(Workspace.GROUP)
@Version(Workspace.VERSION)
@Singular("workspace")
@Plural("workspaces")
@JsonIgnoreProperties(ignoreUnknown = true)
public class Workspace extends CustomResource<WorkspaceSpec, WorkspaceStatus> {

    public static final String GROUP = "tenant.kubesphere.io";
    public static final String VERSION = "v1alpha1";

    /**
     * The namespace label whose value names the workspace a namespace belongs to.
     */
    public static final String WORKSPACE_LABEL = "kubesphere.io/workspace";

    public Workspace() {
        super();
    }

    public Workspace(String name, Map<String, String> labels) {
        super();
        setMetadata(new ObjectMetaBuilder().withName(name).withLabels(labels).build());
    }
}
