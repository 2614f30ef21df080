/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.resource.kubernetes;

import io.fabric8.kubernetes.api.model.Event;
import io.fabric8.kubernetes.api.model.EventBuilder;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectReferenceBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.hybridnet.operator.cluster.operator.resource.EventRecorder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Records core/v1 events through the Kubernetes API. Events about cluster scoped resources are created in the
 * "default" namespace.
 */
public class KubernetesEventRecorder implements EventRecorder {
    private static final Logger LOGGER = LogManager.getLogger(KubernetesEventRecorder.class);
    private static final String CLUSTER_SCOPED_EVENT_NAMESPACE = "default";

    private final KubernetesClient client;
    private final String component;
    private final String instance;
    private final Clock clock;

    /**
     * Constructor
     *
     * @param client        Kubernetes client
     * @param component     Name of the reporting component
     * @param instance      Identity of the reporting instance
     * @param clock         Clock used for the event timestamps
     */
    public KubernetesEventRecorder(KubernetesClient client, String component, String instance, Clock clock) {
        this.client = client;
        this.component = component;
        this.instance = instance;
        this.clock = clock;
    }

    @Override
    public void event(HasMetadata target, String type, String reason, String message) {
        String namespace = target.getMetadata().getNamespace() != null ? target.getMetadata().getNamespace() : CLUSTER_SCOPED_EVENT_NAMESPACE;
        String now = DateTimeFormatter.ISO_INSTANT.format(ZonedDateTime.now(clock));

        Event event = new EventBuilder()
                .withNewMetadata()
                    .withGenerateName(target.getMetadata().getName() + ".")
                    .withNamespace(namespace)
                .endMetadata()
                .withInvolvedObject(new ObjectReferenceBuilder()
                        .withApiVersion(target.getApiVersion())
                        .withKind(target.getKind())
                        .withName(target.getMetadata().getName())
                        .withNamespace(target.getMetadata().getNamespace())
                        .withUid(target.getMetadata().getUid())
                        .withResourceVersion(target.getMetadata().getResourceVersion())
                        .build())
                .withType(type)
                .withReason(reason)
                .withMessage(message)
                .withNewSource()
                    .withComponent(component)
                .endSource()
                .withReportingComponent(component)
                .withReportingInstance(instance)
                .withFirstTimestamp(now)
                .withLastTimestamp(now)
                .withCount(1)
                .build();

        try {
            client.v1().events().inNamespace(namespace).resource(event).create();
        } catch (KubernetesClientException e) {
            LOGGER.warn("Failed to record event {} for {} {}: {}", reason, target.getKind(), target.getMetadata().getName(), e.getMessage());
        }
    }
}
