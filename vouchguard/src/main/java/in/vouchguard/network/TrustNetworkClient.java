package in.vouchguard.network;

import com.fasterxml.jackson.databind.JsonNode;
import in.vouchguard.domain.activity.ActivityType;

import java.util.List;
import java.util.Optional;

/**
 * Trust network API.
 *
 * Read operations tolerate unknown payload fields. Write operations require a
 * valid session credential and throw {@link CredentialExpiredException} otherwise.
 */
public interface TrustNetworkClient {

    String PROFILE_ID_PREFIX = "profileId:";
    String ADDRESS_PREFIX = "address:";

    /**
     * Vouches authored by the given user. Only {@code profileId:<n>} keys are supported;
     * other formats yield an empty list.
     */
    List<NetworkVouch> listVouches(String userKey);

    /**
     * Raw activity payloads received by the user, newest first.
     */
    List<JsonNode> listReceivedActivities(String userKey, List<ActivityType> types, int limit, int offset);

    Optional<NetworkProfile> getProfile(String userKey);

    Optional<NetworkScore> getScore(String userKey);

    ReviewSubmission submitReview(String targetKey, int score, String comment);

    boolean healthCheck();

    /**
     * Replace the bearer session token used on subsequent calls.
     */
    void setSessionToken(String token);

    String profileUrl(String addressOrProfileId);

    static String profileIdToUserKey(long profileId) {
        return PROFILE_ID_PREFIX + profileId;
    }
}
