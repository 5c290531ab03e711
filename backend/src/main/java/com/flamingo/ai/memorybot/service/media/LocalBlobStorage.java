package com.flamingo.ai.memorybot.service.media;

import com.flamingo.ai.memorybot.config.MemoryBotConfig;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Stores blobs on the local filesystem under {@code <base>/<aa>/<bb>/<fingerprint>.<ext>}. The
 * extension comes from the payload signature only, {@code .bin} when none matched.
 *
 * <p>Bytes are written to a temporary file in the target directory and moved into place, so a
 * reader never sees a partially written blob even when two writers race on the same fingerprint.
 */
@Component
@Slf4j
public class LocalBlobStorage implements BlobStorage {

  private final Path basePath;
  private final ContentTypeSniffer sniffer;

  public LocalBlobStorage(MemoryBotConfig config, ContentTypeSniffer sniffer) {
    this.basePath = Path.of(config.getMedia().getBasePath()).toAbsolutePath();
    this.sniffer = sniffer;
  }

  @Override
  public String write(String fingerprint, String signatureType, byte[] bytes) throws IOException {
    Path target = pathFor(fingerprint, signatureType);
    if (Files.exists(target) && Files.size(target) == bytes.length) {
      log.debug("Blob {} already on disk at {}", abbreviate(fingerprint), target);
      return target.toString();
    }

    Path dir = target.getParent();
    Files.createDirectories(dir);
    Path temp = Files.createTempFile(dir, fingerprint, ".tmp");
    try {
      Files.write(temp, bytes);
      try {
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(temp);
    }

    log.debug("Wrote blob {} ({} bytes) to {}", abbreviate(fingerprint), bytes.length, target);
    return target.toString();
  }

  @Override
  public byte[] read(String location) throws IOException {
    return Files.readAllBytes(Path.of(location));
  }

  Path pathFor(String fingerprint, String signatureType) {
    return basePath
        .resolve(fingerprint.substring(0, 2))
        .resolve(fingerprint.substring(2, 4))
        .resolve(fingerprint + sniffer.extensionFor(signatureType));
  }

  static String abbreviate(String fingerprint) {
    return fingerprint.length() > 8 ? fingerprint.substring(0, 8) : fingerprint;
  }
}
