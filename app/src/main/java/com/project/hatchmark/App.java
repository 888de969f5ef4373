package com.project.hatchmark;

import com.project.hatchmark.config.HatchmarkConfig;
import com.project.hatchmark.config.HatchmarkRuntime;
import com.project.hatchmark.core.DuplicateException;
import com.project.hatchmark.core.VerificationResult;
import com.project.hatchmark.fingerprint.Fingerprint;
import com.project.hatchmark.fingerprint.PerceptualHasher;
import com.project.hatchmark.indexer.EventIndexer;
import com.project.hatchmark.ledger.InProcessRegistryLedger;
import com.project.hatchmark.ledger.KeyPairSigner;
import com.project.hatchmark.ledger.Resolution;
import com.project.hatchmark.ledger.Signer;
import com.project.hatchmark.workflow.CancellationToken;
import com.project.hatchmark.workflow.ClientWorkflow;
import com.project.hatchmark.workflow.WorkflowResult;
import org.web3j.crypto.Keys;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

/**
 * End-to-end walk through register, verify, flag and resolve on an in-process ledger with an
 * in-memory projection kept current by a background indexer.
 *
 * Usage: java App [originalImage] [suspectImage]
 * Without arguments two synthetic images are generated: an original and a brightened copy.
 */
public class App {
    public static void main(String[] args) {
        try {
            System.out.println("==========================================================================================");
            System.out.println("                    HATCHMARK - register, verify and dispute an image                     ");
            System.out.println("==========================================================================================");
            System.out.println();

            byte[] original;
            byte[] suspect;
            if (args.length >= 2) {
                original = Files.readAllBytes(Paths.get(args[0]));
                suspect = Files.readAllBytes(Paths.get(args[1]));
                System.out.println("Original: " + args[0]);
                System.out.println("Suspect:  " + args[1]);
            } else {
                original = png(render(256, 192, 0));
                suspect = png(render(200, 150, 12));
                System.out.println("No images given; using a generated original and a resized, brightened copy.");
            }
            System.out.println();

            Map<String, String> env = new HashMap<>(System.getenv());
            env.remove("LEDGER_RPC_URL");
            env.put("STORE_KIND", "memory");
            env.putIfAbsent("INDEXER_POLL_INTERVAL_MS", "200");
            env.putIfAbsent("SYNC_BACKOFF_MS", "250");
            HatchmarkConfig config = HatchmarkConfig.fromEnv(env);

            System.out.println("[1/7] Starting in-process ledger, store and indexer...");
            try (HatchmarkRuntime runtime = new HatchmarkRuntime(config);
                 EventIndexer indexer = runtime.newIndexer()) {
                indexer.start();
                InProcessRegistryLedger ledger = runtime.localLedger().orElseThrow();
                ClientWorkflow workflow = runtime.newWorkflow();
                System.out.println("      ✓ Package " + runtime.packageId() + ", minimum stake " + config.minimumStake());

                System.out.println();
                System.out.println("[2/7] Creating creator and flagger keys...");
                Signer creator = new KeyPairSigner(Keys.createEcKeyPair());
                Signer flagger = new KeyPairSigner(Keys.createEcKeyPair());
                System.out.println("      ✓ Creator: " + creator.address());
                System.out.println("      ✓ Flagger: " + flagger.address());

                System.out.println();
                System.out.println("[3/7] Fingerprinting both images...");
                PerceptualHasher hasher = new PerceptualHasher();
                Fingerprint originalHash = hasher.fingerprint(original);
                Fingerprint suspectHash = hasher.fingerprint(suspect);
                System.out.println("      ✓ Original: " + originalHash.hex());
                System.out.println("      ✓ Suspect:  " + suspectHash.hex());

                System.out.println();
                System.out.println("[4/7] Registering the original...");
                WorkflowResult registered = workflow.register(original, "Harbour at dusk",
                        "Generated demo image", creator, CancellationToken.never());
                String certId = registered.objectId();
                System.out.println("      ✓ Certificate " + certId + " (tx " + registered.txDigest() + ")");
                System.out.println("      ✓ Indexed after " + registered.syncAttempts() + " store poll(s)");

                System.out.println();
                System.out.println("[5/7] Registering the suspect must be refused as a duplicate...");
                try {
                    workflow.register(suspect, "Harbour copy", "", flagger, CancellationToken.never());
                    System.err.println("      ✗ Suspect was accepted as an original");
                } catch (DuplicateException e) {
                    System.out.println("      ✓ " + e.getMessage());
                }

                System.out.println();
                System.out.println("[6/7] Verifying the suspect and opening a dispute...");
                VerificationResult verification = runtime.verification().verify(suspectHash.hex());
                verification.matches().forEach(match -> System.out.printf(
                        "      ℹ %s by %s: %d%% similar (distance %d)%n",
                        match.certId(), match.creator(), match.similarity(), match.hammingDistance()));
                WorkflowResult flagged = workflow.flag(suspect, certId, config.minimumStake(), flagger,
                        CancellationToken.never());
                System.out.println("      ✓ Dispute " + flagged.objectId() + " opened with stake " + config.minimumStake());

                System.out.println();
                System.out.println("[7/7] Creator rejects the dispute...");
                WorkflowResult resolved = workflow.resolve(flagged.objectId(), certId, Resolution.INVALID, creator,
                        CancellationToken.never());
                System.out.println("      ✓ Dispute " + resolved.objectId() + " resolved in " + resolved.txDigest());
                System.out.println("      ✓ Creator balance: " + ledger.balanceOf(creator.address()));
                System.out.println("      ✓ Escrowed stake:  " + ledger.escrowedStake());
                runtime.store().disputesForCertificate(certId).forEach(dispute -> System.out.println(
                        "      ℹ Projection: dispute " + dispute.disputeId() + " is " + dispute.status()));
            }
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    /**
     * Smooth multi-frequency pattern; {@code brightness} shifts every channel.
     */
    private static BufferedImage render(int width, int height, int brightness) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            double v = (y + 0.5) / height;
            for (int x = 0; x < width; x++) {
                double u = (x + 0.5) / width;
                double s = 0;
                for (int ky = 0; ky < 8; ky++) {
                    for (int kx = 0; kx < 8; kx++) {
                        if (kx == 0 && ky == 0) {
                            continue;
                        }
                        double amp = 12 * Math.sin(kx * 1.7 + ky * 2.9 + kx * ky * 0.37);
                        s += amp * Math.cos(Math.PI * kx * u) * Math.cos(Math.PI * ky * v);
                    }
                }
                int r = clamp(128 + s + brightness);
                int g = clamp(120 + 0.9 * s + brightness);
                int b = clamp(136 + 1.1 * s + brightness);
                image.setRGB(x, y, (r << 16) | (g << 8) | b);
            }
        }
        return image;
    }

    private static int clamp(double value) {
        return (int) Math.max(0, Math.min(255, Math.floor(value + 0.5)));
    }

    private static byte[] png(BufferedImage image) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        return out.toByteArray();
    }
}
