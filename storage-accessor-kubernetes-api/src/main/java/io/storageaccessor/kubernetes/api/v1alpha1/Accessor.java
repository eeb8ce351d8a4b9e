/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.api.v1alpha1;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.Singular;
import io.fabric8.kubernetes.model.annotation.Version;

/**
 * A cluster scoped policy that restricts which namespaces, and which workspaces those namespaces
 * belong to, may create claims against a storage class.
 */
@Group(Accessor.GROUP)
@Version(Accessor.VERSION)
@Singular("accessor")
@Plural("accessors")
@JsonIgnoreProperties(ignoreUnknown = true)
public class Accessor extends CustomResource<AccessorSpec, Void> {

    public static final String GROUP = "storage.kubesphere.io";
    public static final String VERSION = "v1alpha1";

    public Accessor() {
        super();
    }

    public Accessor(String name, AccessorSpec spec) {
        super();
        setMetadata(new ObjectMetaBuilder().withName(name).build());
        setSpec(spec);
    }

    @Override
    protected AccessorSpec initSpec() {
        return new AccessorSpec();
    }
}
