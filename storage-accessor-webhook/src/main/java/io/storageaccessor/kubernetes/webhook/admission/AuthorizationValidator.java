/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook.admission;

import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.ObjectMeta;

import io.storageaccessor.kubernetes.api.tenant.v1alpha1.Workspace;
import io.storageaccessor.kubernetes.api.v1alpha1.Accessor;
import io.storageaccessor.kubernetes.api.v1alpha1.AccessorSpec;
import io.storageaccessor.kubernetes.api.v1alpha1.accessorspec.ScopeSelector;
import io.storageaccessor.kubernetes.webhook.resolver.ScopeResolver;
import io.storageaccessor.kubernetes.webhook.selector.ScopeSelectorEvaluator;
import io.storageaccessor.kubernetes.webhook.selector.SelectorTarget;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Decides whether a single Accessor authorizes a claim, by testing the claim's namespace against the
 * Accessor's namespace selector and then, if the namespace belongs to a workspace, testing that workspace
 * against the workspace selector.
 */
public class AuthorizationValidator {

    private static final Logger LOGGER = LoggerFactory.getLogger(AuthorizationValidator.class);

    private final ScopeResolver scopeResolver;

    public AuthorizationValidator(ScopeResolver scopeResolver) {
        this.scopeResolver = Objects.requireNonNull(scopeResolver);
    }

    /**
     * @param claim claim being admitted
     * @param accessor an Accessor governing the claim's storage class
     * @return the result
     * @throws io.storageaccessor.kubernetes.webhook.resolver.ScopeResolutionException if the namespace or workspace cannot be resolved
     */
    public AuthorizationResult authorize(ClaimRequest claim, Accessor accessor) {
        Optional<AccessorSpec> spec = Optional.ofNullable(accessor.getSpec());
        String accessorName = accessor.getMetadata().getName();

        Namespace namespace = scopeResolver.namespace(claim.namespace());
        ScopeSelector namespaceSelector = spec.map(AccessorSpec::getNamespaceSelector).orElse(null);
        if (!ScopeSelectorEvaluator.matches(namespaceSelector, SelectorTarget.of(namespace))) {
            return denied(claim, "namespace " + claim.namespace() + " does not satisfy the namespaceSelector of Accessor " + accessorName);
        }

        String workspaceName = workspaceOf(namespace);
        if (workspaceName == null) {
            LOGGER.debug("Namespace {} belongs to no workspace, skipping the workspaceSelector of Accessor {}", claim.namespace(), accessorName);
            return AuthorizationResult.permitted();
        }

        Workspace workspace = scopeResolver.workspace(workspaceName);
        ScopeSelector workspaceSelector = spec.map(AccessorSpec::getWorkspaceSelector).orElse(null);
        if (!ScopeSelectorEvaluator.matches(workspaceSelector, SelectorTarget.of(workspace))) {
            return denied(claim, "workspace " + workspaceName + " of namespace " + claim.namespace()
                    + " does not satisfy the workspaceSelector of Accessor " + accessorName);
        }
        return AuthorizationResult.permitted();
    }

    @Nullable
    private static String workspaceOf(Namespace namespace) {
        return Optional.ofNullable(namespace.getMetadata())
                .map(ObjectMeta::getLabels)
                .map(labels -> labels.get(Workspace.WORKSPACE_LABEL))
                .filter(name -> !name.isEmpty())
                .orElse(null);
    }

    private static AuthorizationResult denied(ClaimRequest claim, String detail) {
        return AuthorizationResult.denied(claim.describe() + " is not permitted to use storage class " + claim.storageClassName() + ": " + detail);
    }
}
