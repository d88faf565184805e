package in.vouchguard.network;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Display data for a trust network user.
 */
public record NetworkProfile(String name, String address, String avatarUrl) {

    /**
     * Read a profile from any of the user/profile payload shapes the network returns.
     */
    public static NetworkProfile fromJson(JsonNode node) {
        String name = firstText(node, "displayName", "name", "username");
        String avatar = firstText(node, "avatarUrl", "avatar");
        String address = firstText(node, "primaryAddress");
        if (address == null) {
            address = addressFromUserkeys(node).orElse(null);
        }
        return new NetworkProfile(name, address, avatar);
    }

    public boolean hasAddress() {
        return address != null && !address.isBlank();
    }

    private static Optional<String> addressFromUserkeys(JsonNode node) {
        JsonNode userkeys = node.path("userkeys");
        if (!userkeys.isArray()) {
            return Optional.empty();
        }
        for (JsonNode key : userkeys) {
            String text = key.asText("");
            if (text.startsWith("address:")) {
                return Optional.of(text.substring("address:".length()));
            }
        }
        return Optional.empty();
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }
}
