package io.matrixlabs.planner;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** The hex md5 digest of the metadata's canonical JSON form. */
public class Md5MatrixIdentifier implements MatrixIdentifier {

    @Override
    public String identify(MatrixMetadata metadata) {
        byte[] json = CanonicalJson.write(metadata.asMap()).getBytes(StandardCharsets.UTF_8);
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("MD5").digest(json));
        } catch (NoSuchAlgorithmException e) {
            // every java platform is required to support md5
            throw new IllegalStateException("MD5 digest not available", e);
        }
    }
}
