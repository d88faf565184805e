package in.vouchguard.repository;

import in.vouchguard.domain.relation.Relationship;

import java.util.List;
import java.util.Optional;

public interface RelationshipRepository {
    /**
     * Insert or refresh name, address, avatar and active flag. Score and createdAt are preserved.
     */
    void upsert(Relationship relationship);

    Optional<Relationship> findById(String id);

    /**
     * @param active null for all relationships
     */
    List<Relationship> findAll(Boolean active);

    void updateScore(String id, int score);

    int count();

    int countActive();
}
