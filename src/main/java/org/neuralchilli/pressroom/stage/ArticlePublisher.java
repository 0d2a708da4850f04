package org.neuralchilli.pressroom.stage;

import org.neuralchilli.pressroom.domain.PublicationReceipt;
import org.neuralchilli.pressroom.domain.PublishRequest;

/**
 * Publishes an article to a platform, or stores it there as a draft when
 * {@link PublishRequest#draftOnly()} is set.
 * <p>
 * The runner may call this more than once for the same article after a
 * transient failure; implementations should make a repeated call harmless.
 */
public interface ArticlePublisher {

    PublicationReceipt publish(PublishRequest request, PublisherCredentials credentials);
}
