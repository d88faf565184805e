package in.vouchguard.network;

public record NetworkScore(
    long profileId,
    int score,
    int reviewsReceived,
    int reviewsGiven,
    int vouchesReceived,
    int vouchesGiven
) {}
