package io.walkie.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * One record of the peer wire protocol. {@code t} is {@code "hello"} or {@code "msg"};
 * fields not used by a record type stay null and are left out of the encoding.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record PeerFrame(
        String t,
        List<String> topics,
        String topic,
        String data,
        String id,
        Long ts
) {
    public static final String HELLO = "hello";
    public static final String MSG = "msg";

    public static PeerFrame hello(List<String> topics, String instanceId) {
        return new PeerFrame(HELLO, List.copyOf(topics), null, null, instanceId, null);
    }

    public static PeerFrame msg(String topicHex, String data, String instanceId, long ts) {
        return new PeerFrame(MSG, null, topicHex, data, instanceId, ts);
    }

    @JsonIgnore
    public boolean isHello() {
        return HELLO.equals(t);
    }

    @JsonIgnore
    public boolean isMsg() {
        return MSG.equals(t);
    }
}
