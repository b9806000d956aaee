package org.janelia.imagestack.pixel;

/**
 * Supported on-disk tile formats.
 * The core only uses a format to choose a file extension and a {@link TileWriter}.
 *
 * @author Eric Trautman
 */
public enum TileFormat {

    NUMPY("npy"),
    TIFF("tiff"),
    PNG("png");

    private final String fileExtension;

    TileFormat(final String fileExtension) {
        this.fileExtension = fileExtension;
    }

    public String getFileExtension() {
        return fileExtension;
    }
}
