package io.walkie.crypto;

import io.walkie.config.WalkieConfig;
import io.walkie.model.Topic;
import io.walkie.util.Hashing;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Maps a channel name and shared secret to the topic announced on the mesh.
 *
 * <p>The digest input is {@code <namespace>:<channel>:<secret>}, so daemons that
 * agree on both the channel name and the secret land on the same topic, and
 * reusing a secret across channel names still yields unrelated topics.
 */
public final class TopicDerivation {
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final int INSTANCE_ID_BYTES = 4;

    private TopicDerivation() {
    }

    public static Topic deriveTopic(String channelName, String secret) {
        Objects.requireNonNull(channelName, "channelName");
        Objects.requireNonNull(secret, "secret");
        String label = WalkieConfig.TOPIC_NAMESPACE + ":" + channelName + ":" + secret;
        return new Topic(Hashing.sha256(label));
    }

    public static String newInstanceId() {
        byte[] raw = new byte[INSTANCE_ID_BYTES];
        RANDOM.nextBytes(raw);
        return HexFormat.of().formatHex(raw);
    }
}
