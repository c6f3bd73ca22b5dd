package com.flamingo.ai.foliospec.service.extraction;

import com.flamingo.ai.foliospec.domain.model.FileType;
import com.flamingo.ai.foliospec.service.storage.BlobStore;
import com.flamingo.ai.foliospec.service.storage.ByteRange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Classifies a document by its magic bytes. Never throws. */
@Component
@Slf4j
public class FileTypeSniffer {

  /** Number of leading bytes needed to classify a document. */
  public static final int PREFIX_LENGTH = 8;

  private static final byte[] PDF_MAGIC = {'%', 'P', 'D', 'F'};
  private static final byte[] ZIP_MAGIC = {'P', 'K', 0x03, 0x04};

  /**
   * Classifies a byte prefix.
   *
   * @param prefix leading bytes of a document, may be shorter than {@link #PREFIX_LENGTH} or null
   * @return {@link FileType#PDF}, {@link FileType#DOCX} or {@link FileType#UNKNOWN}
   */
  public FileType sniff(byte[] prefix) {
    if (startsWith(prefix, PDF_MAGIC)) {
      return FileType.PDF;
    }
    if (startsWith(prefix, ZIP_MAGIC)) {
      return FileType.DOCX;
    }
    return FileType.UNKNOWN;
  }

  /**
   * Reads the first {@link #PREFIX_LENGTH} bytes of a stored document and classifies them.
   *
   * @return detected type, {@link FileType#UNKNOWN} when the read fails
   */
  public FileType sniff(BlobStore blobStore, String bucket, String key) {
    try {
      return sniff(blobStore.get(bucket, key, ByteRange.prefix(PREFIX_LENGTH)));
    } catch (RuntimeException e) {
      log.warn("Could not read header of {}/{}: {}", bucket, key, e.getMessage());
      return FileType.UNKNOWN;
    }
  }

  private static boolean startsWith(byte[] data, byte[] magic) {
    if (data == null || data.length < magic.length) {
      return false;
    }
    for (int i = 0; i < magic.length; i++) {
      if (data[i] != magic[i]) {
        return false;
      }
    }
    return true;
  }
}
