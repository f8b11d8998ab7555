package io.bibliotek.upload.exception;

/**
 * A single chunk could not be stored. The caller may retry the identical chunk; the
 * backend overwrites a part number on every upload.
 */
public class PartUploadFailedException extends UploadException {

    private final int partNumber;

    public PartUploadFailedException(String uploadId, int partNumber, Throwable cause) {
        super("Failed to upload part " + partNumber + " of upload " + uploadId, cause);
        this.partNumber = partNumber;
    }

    public int getPartNumber() {
        return partNumber;
    }
}
