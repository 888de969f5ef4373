package com.project.hatchmark.ledger;

import com.project.hatchmark.fingerprint.Fingerprint;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Builds descriptors for the three registry entry functions.
 */
public class TransactionBuilder {

    public static final String FN_REGISTER = "register";
    public static final String FN_FLAG = "flag_content";
    public static final String FN_RESOLVE = "resolve_dispute";

    public static final String ARG_IMAGE_HASH = "image_hash";
    public static final String ARG_TITLE = "title";
    public static final String ARG_DESCRIPTION = "description";
    public static final String ARG_CERT_ID = "cert_id";
    public static final String ARG_FLAGGED_HASH = "flagged_hash";
    public static final String ARG_SIMILARITY_SCORE = "similarity_score";
    public static final String ARG_STAKE = "stake";
    public static final String ARG_DISPUTE_ID = "dispute_id";
    public static final String ARG_RESOLUTION = "resolution";

    private final String packageId;

    public TransactionBuilder(String packageId) {
        this.packageId = Objects.requireNonNull(packageId, "packageId must not be null");
    }

    public String packageId() {
        return packageId;
    }

    public UnsignedTransaction register(Fingerprint hash, String title, String description, String sender) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put(ARG_IMAGE_HASH, hash.hex());
        args.put(ARG_TITLE, title);
        args.put(ARG_DESCRIPTION, description);
        return build(FN_REGISTER, args, sender, Map.of());
    }

    public UnsignedTransaction flag(String certId, Fingerprint flaggedHash, int distance, long stake,
                                    String sender, Map<String, Object> annotations) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put(ARG_CERT_ID, certId);
        args.put(ARG_FLAGGED_HASH, flaggedHash.hex());
        args.put(ARG_SIMILARITY_SCORE, distance);
        args.put(ARG_STAKE, stake);
        return build(FN_FLAG, args, sender, annotations);
    }

    public UnsignedTransaction resolve(String disputeId, String certId, Resolution resolution, String sender) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put(ARG_DISPUTE_ID, disputeId);
        args.put(ARG_CERT_ID, certId);
        args.put(ARG_RESOLUTION, resolution.name());
        return build(FN_RESOLVE, args, sender, Map.of());
    }

    private UnsignedTransaction build(String function, Map<String, Object> args, String sender,
                                      Map<String, Object> annotations) {
        return new UnsignedTransaction(packageId, EventType.MODULE, function, args, sender,
                UUID.randomUUID().toString(), annotations);
    }
}
