package com.challenges.kubesql.config;

import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ContextValidatorTest {
    private final Kubeconfig kubeconfig = new Kubeconfig(Lists.immutable.of("minikube", "prod-cluster"), "minikube");

    @Test
    public void testKnownContextsPass() {
        assertDoesNotThrow(() -> ContextValidator.validateContexts(kubeconfig,
                Lists.immutable.of("prod-cluster", "minikube")));
    }

    @Test
    public void testReportsEveryMissingContextInQueryOrder() {
        ContextNotFoundException e = assertThrows(ContextNotFoundException.class,
                () -> ContextValidator.validateContexts(kubeconfig,
                        Lists.immutable.of("staging", "minikube", "dev")));

        assertEquals(Lists.immutable.of("staging", "dev"), e.contexts());
        assertEquals("Context not found in your KUBECONFIG: [staging, dev]", e.getMessage());
    }
}
