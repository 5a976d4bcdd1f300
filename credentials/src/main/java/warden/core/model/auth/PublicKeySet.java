package warden.core.model.auth;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.jose4j.json.JsonUtil;

/**
 * All public keys currently valid for verification.
 */
public record PublicKeySet(List<PublicKeyDescriptor> keys) {

    public PublicKeySet {
        keys = keys == null ? List.of() : List.copyOf(keys);
    }

    public Optional<PublicKeyDescriptor> find(String keyId) {
        return keys.stream().filter(k -> k.keyId().equals(keyId)).findFirst();
    }

    /**
     * Render the set as a JWKS document ({@code {"keys":[...]}}).
     */
    public String toJson() {
        return JsonUtil.toJson(Map.of("keys", keys.stream().map(PublicKeyDescriptor::jwk).toList()));
    }
}
