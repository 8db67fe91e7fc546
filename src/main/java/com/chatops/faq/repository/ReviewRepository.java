package com.chatops.faq.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.chatops.faq.config.AerospikeConfig;
import com.chatops.faq.exception.InvalidTransitionException;
import com.chatops.faq.exception.PersistenceException;
import com.chatops.faq.exception.ReviewNotFoundException;
import com.chatops.faq.model.ReviewAction;
import com.chatops.faq.model.ReviewRecord;
import com.chatops.faq.model.ReviewStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Consumer;

/**
 * Durable store of review records. Records are only ever created or moved along the
 * review lifecycle; nothing is deleted.
 */
@Repository
public class ReviewRepository {

    private static final Logger log = LoggerFactory.getLogger(ReviewRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ScanPolicy scanPolicy;

    public ReviewRepository(AerospikeClient client,
                            @Qualifier("aerospikeNamespace") String namespace,
                            @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                            @Qualifier("defaultReadPolicy") Policy readPolicy,
                            @Qualifier("reviewScanPolicy") ScanPolicy scanPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.scanPolicy = scanPolicy;
    }

    /**
     * New review id: {@code review_<epoch millis>_<7 random base-36 chars>}.
     */
    public static String generateReviewId(long now) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder suffix = new StringBuilder(7);
        for (int i = 0; i < 7; i++) {
            suffix.append(Character.forDigit(random.nextInt(36), 36));
        }
        return "review_" + now + "_" + suffix;
    }

    public void create(ReviewRecord review) {
        Key key = key(review.getReviewId());

        WritePolicy createPolicy = new WritePolicy(writePolicy);
        createPolicy.recordExistsAction = RecordExistsAction.CREATE_ONLY;

        try {
            client.put(createPolicy, key,
                    new Bin("reviewId", review.getReviewId()),
                    new Bin("srcMessageId", nvl(review.getSourceMessageId())),
                    new Bin("roomId", nvl(review.getRoomId())),
                    new Bin("roomType", nvl(review.getRoomType())),
                    new Bin("roomName", nvl(review.getRoomName())),
                    new Bin("senderId", nvl(review.getSenderId())),
                    new Bin("senderUsername", nvl(review.getSenderUsername())),
                    new Bin("originalText", nvl(review.getOriginalMessageText())),
                    new Bin("detectedQ", nvl(review.getDetectedQuestion())),
                    new Bin("proposedAnswer", nvl(review.getProposedAnswer())),
                    new Bin("createdAt", review.getCreatedAt()),
                    new Bin("status", review.getStatus().name()),
                    new Bin("reviewerId", nvl(review.getReviewerId())),
                    new Bin("reviewerName", nvl(review.getReviewerUsername())),
                    new Bin("actedBy", nvl(review.getActedBy())),
                    new Bin("actedAt", review.getActedAt()));
        } catch (AerospikeException e) {
            throw new PersistenceException("Failed to create review " + review.getReviewId(), e);
        }
    }

    public ReviewRecord findById(String reviewId) {
        try {
            Record record = client.get(readPolicy, key(reviewId));
            if (record == null) return null;
            return mapRecord(record);
        } catch (AerospikeException e) {
            throw new PersistenceException("Failed to read review " + reviewId, e);
        }
    }

    /**
     * Moves a review along one lifecycle edge.
     *
     * The current record is re-read and its status checked against the action's source
     * state; the write is then conditioned on the record generation that was read, so a
     * concurrent transition that lands in between makes this one fail instead of
     * overwriting it.
     *
     * @param newAnswer replacement answer text, only used by {@link ReviewAction#SUBMIT_EDIT}
     * @return the record as written
     * @throws ReviewNotFoundException    if no review has this id
     * @throws InvalidTransitionException if the review is not in the action's source state,
     *                                    including when another writer got there first
     */
    public ReviewRecord transition(String reviewId, ReviewAction action, String actor, String newAnswer) {
        Key key = key(reviewId);
        Record record;
        try {
            record = client.get(readPolicy, key);
        } catch (AerospikeException e) {
            throw new PersistenceException("Failed to read review " + reviewId, e);
        }
        if (record == null) {
            throw new ReviewNotFoundException(reviewId);
        }

        ReviewRecord current = mapRecord(record);
        if (!action.isAllowedFrom(current.getStatus())) {
            throw new InvalidTransitionException(reviewId, action, current.getStatus());
        }

        long now = System.currentTimeMillis();
        WritePolicy casPolicy = new WritePolicy(writePolicy);
        casPolicy.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
        casPolicy.generation = record.generation;
        casPolicy.recordExistsAction = RecordExistsAction.UPDATE_ONLY;

        List<Bin> bins = new ArrayList<>();
        bins.add(new Bin("status", action.getTo().name()));
        bins.add(new Bin("actedBy", nvl(actor)));
        bins.add(new Bin("actedAt", now));
        if (action == ReviewAction.SUBMIT_EDIT) {
            bins.add(new Bin("proposedAnswer", nvl(newAnswer)));
        }

        try {
            client.put(casPolicy, key, bins.toArray(new Bin[0]));
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.GENERATION_ERROR) {
                ReviewRecord latest = findById(reviewId);
                ReviewStatus latestStatus = latest != null ? latest.getStatus() : current.getStatus();
                log.warn("Concurrent update on review {}: {} lost the race, status is now {}",
                        reviewId, action, latestStatus);
                throw new InvalidTransitionException(reviewId, action, latestStatus);
            }
            throw new PersistenceException("Failed to update review " + reviewId, e);
        }

        ReviewRecord.ReviewRecordBuilder updated = current.toBuilder()
                .status(action.getTo())
                .actedBy(actor)
                .actedAt(now);
        if (action == ReviewAction.SUBMIT_EDIT) {
            updated.proposedAnswer(newAnswer);
        }
        return updated.build();
    }

    public List<ReviewRecord> findByStatus(ReviewStatus status) {
        List<ReviewRecord> results = new ArrayList<>();
        scan(record -> {
            if (status.name().equals(record.getString("status"))) {
                results.add(mapRecord(record));
            }
        });
        return results;
    }

    /**
     * Newest first. A null status lists every review.
     */
    public List<ReviewRecord> findRecent(ReviewStatus status, int limit) {
        List<ReviewRecord> results = new ArrayList<>();
        scan(record -> {
            if (status == null || status.name().equals(record.getString("status"))) {
                results.add(mapRecord(record));
            }
        });
        results.sort(Comparator.comparingLong(ReviewRecord::getCreatedAt).reversed());
        return results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
    }

    public Map<ReviewStatus, Integer> countByStatus() {
        Map<ReviewStatus, Integer> counts = new EnumMap<>(ReviewStatus.class);
        for (ReviewStatus status : ReviewStatus.values()) {
            counts.put(status, 0);
        }
        scan(record -> {
            ReviewStatus status = ReviewStatus.valueOf(record.getString("status"));
            counts.merge(status, 1, Integer::sum);
        });
        return counts;
    }

    private void scan(Consumer<Record> consumer) {
        try {
            client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_REVIEWS,
                    (key, record) -> {
                        try {
                            synchronized (this) {
                                consumer.accept(record);
                            }
                        } catch (Exception e) {
                            log.warn("Failed to read review record: {}", e.getMessage());
                        }
                    });
        } catch (AerospikeException e) {
            throw new PersistenceException("Failed to scan reviews", e);
        }
    }

    private Key key(String reviewId) {
        return new Key(namespace, AerospikeConfig.SET_REVIEWS, reviewId);
    }

    private ReviewRecord mapRecord(Record record) {
        return ReviewRecord.builder()
                .reviewId(record.getString("reviewId"))
                .sourceMessageId(emptyToNull(record.getString("srcMessageId")))
                .roomId(emptyToNull(record.getString("roomId")))
                .roomType(emptyToNull(record.getString("roomType")))
                .roomName(emptyToNull(record.getString("roomName")))
                .senderId(emptyToNull(record.getString("senderId")))
                .senderUsername(emptyToNull(record.getString("senderUsername")))
                .originalMessageText(record.getString("originalText"))
                .detectedQuestion(record.getString("detectedQ"))
                .proposedAnswer(record.getString("proposedAnswer"))
                .createdAt(record.getLong("createdAt"))
                .status(ReviewStatus.valueOf(record.getString("status")))
                .reviewerId(emptyToNull(record.getString("reviewerId")))
                .reviewerUsername(emptyToNull(record.getString("reviewerName")))
                .actedBy(emptyToNull(record.getString("actedBy")))
                .actedAt(record.getLong("actedAt"))
                .build();
    }

    private static String nvl(String value) {
        return value != null ? value : "";
    }

    private static String emptyToNull(String value) {
        return value != null && !value.isEmpty() ? value : null;
    }
}
