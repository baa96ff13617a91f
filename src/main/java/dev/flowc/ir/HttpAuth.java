package dev.flowc.ir;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Authentication applied to an HTTP request. Every form names the secrets it reads.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = HttpAuth.HeaderAuth.class, name = "headerAuth"),
    @JsonSubTypes.Type(value = HttpAuth.BasicAuth.class, name = "basicAuth"),
    @JsonSubTypes.Type(value = HttpAuth.BearerToken.class, name = "bearerToken"),
    @JsonSubTypes.Type(value = HttpAuth.QueryAuth.class, name = "queryAuth")
})
public sealed interface HttpAuth {

    List<String> secretNames();

    record HeaderAuth(String headerName, String valueSecret) implements HttpAuth {
        @Override
        public List<String> secretNames() {
            return List.of(valueSecret);
        }
    }

    record BasicAuth(String usernameSecret, String passwordSecret) implements HttpAuth {
        @Override
        public List<String> secretNames() {
            return List.of(usernameSecret, passwordSecret);
        }
    }

    record BearerToken(String tokenSecret) implements HttpAuth {
        @Override
        public List<String> secretNames() {
            return List.of(tokenSecret);
        }
    }

    record QueryAuth(String paramName, String valueSecret) implements HttpAuth {
        @Override
        public List<String> secretNames() {
            return List.of(valueSecret);
        }
    }
}
