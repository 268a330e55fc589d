package au.org.ala.imagedate.session;

import au.org.ala.imagedate.normalize.NormalizationResult;

import java.awt.image.BufferedImage;
import java.io.File;

public class ImageLoadResult {

    private final File _file;
    private final boolean _loaded;
    private final BufferedImage _preview;
    private final NormalizationResult _normalization;
    private final String _statusLine;

    private ImageLoadResult(File file, boolean loaded, BufferedImage preview, NormalizationResult normalization, String statusLine) {
        _file = file;
        _loaded = loaded;
        _preview = preview;
        _normalization = normalization;
        _statusLine = statusLine;
    }

    public static ImageLoadResult loaded(File file, BufferedImage preview, NormalizationResult normalization, String statusLine) {
        return new ImageLoadResult(file, true, preview, normalization, statusLine);
    }

    public static ImageLoadResult failed(File file, String message) {
        return new ImageLoadResult(file, false, null, null, String.format("Error loading %s: %s", file.getName(), message));
    }

    public File getFile() {
        return _file;
    }

    public boolean isLoaded() {
        return _loaded;
    }

    /**
     * @return the scaled RGB preview, null if the file couldn't be loaded
     */
    public BufferedImage getPreview() {
        return _preview;
    }

    public NormalizationResult getNormalization() {
        return _normalization;
    }

    public String getStatusLine() {
        return _statusLine;
    }
}
