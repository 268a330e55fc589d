package au.org.ala.imagedate.session;

import au.org.ala.imagedate.dates.DateParser;
import au.org.ala.imagedate.dates.DateWriteResult;
import au.org.ala.imagedate.dates.ImageDateWriter;
import au.org.ala.imagedate.dates.NaturalLanguageDateParser;
import au.org.ala.imagedate.normalize.ImageNormalizer;
import au.org.ala.imagedate.normalize.NormalizationResult;
import au.org.ala.imagedate.raster.RasterImage;
import au.org.ala.imagedate.raster.RasterImages;
import au.org.ala.imagedate.util.DecodeFailureException;
import au.org.ala.imagedate.util.DecodedImage;
import au.org.ala.imagedate.util.ImageDecoder;
import au.org.ala.imagedate.util.ImageFileEnumerator;
import au.org.ala.imagedate.util.ImageUtils;
import com.google.common.base.Preconditions;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.File;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Walks the images of one folder: previews the current file and stamps dates into it.
 * <p/>
 * A file that can't be decoded only fails its own load; navigation carries on. Not thread safe.
 */
public class ImageDateSession {

    private static final Logger log = LoggerFactory.getLogger(ImageDateSession.class);

    private final File _folder;
    private final List<File> _files;
    private final EditorConfig _config;
    private final ImageDecoder _decoder;
    private final ImageNormalizer _normalizer;
    private final DateParser _dateParser;
    private final ImageDateWriter _dateWriter;

    private int _index = 0;
    private String _lastDateText = "";

    public ImageDateSession(File folder) {
        this(folder, EditorConfig.load());
    }

    public ImageDateSession(File folder, EditorConfig config) {
        this(folder, config, new ImageFileEnumerator(config.getExtensions()), new ImageDecoder(),
                new ImageNormalizer(config.getBackgroundColor()), new NaturalLanguageDateParser(),
                new ImageDateWriter(config.getDateTagPattern()));
    }

    public ImageDateSession(File folder, EditorConfig config, ImageFileEnumerator enumerator, ImageDecoder decoder,
                            ImageNormalizer normalizer, DateParser dateParser, ImageDateWriter dateWriter) {
        _folder = folder;
        _config = config;
        _decoder = decoder;
        _normalizer = normalizer;
        _dateParser = dateParser;
        _dateWriter = dateWriter;
        _files = enumerator.listImages(folder);
        log.info("Found {} image(s) in {}", _files.size(), folder);
    }

    public File getFolder() {
        return _folder;
    }

    public List<File> getFiles() {
        return _files;
    }

    public boolean isEmpty() {
        return _files.isEmpty();
    }

    public int getIndex() {
        return _index;
    }

    public File getCurrentFile() {
        Preconditions.checkState(!_files.isEmpty(), "No images in %s", _folder);
        return _files.get(_index);
    }

    public boolean hasNext() {
        return _index < _files.size() - 1;
    }

    public boolean hasPrevious() {
        return _index > 0;
    }

    /**
     * @return false if already at the last image
     */
    public boolean next() {
        if (!hasNext()) {
            return false;
        }
        _index++;
        return true;
    }

    /**
     * @return false if already at the first image
     */
    public boolean previous() {
        if (!hasPrevious()) {
            return false;
        }
        _index--;
        return true;
    }

    /**
     * Move to the image with the given file name.
     *
     * @return false if there is no such image in the folder
     */
    public boolean select(String filename) {
        for (int i = 0; i < _files.size(); i++) {
            if (_files.get(i).getName().equals(filename)) {
                _index = i;
                return true;
            }
        }
        return false;
    }

    public ImageLoadResult loadCurrent() {
        File file = getCurrentFile();
        DecodedImage decoded;
        try {
            decoded = _decoder.decode(file);
        } catch (DecodeFailureException e) {
            log.warn("Skipping {}: {}", file.getName(), e.getMessage());
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return ImageLoadResult.failed(file, String.valueOf(cause.getMessage()));
        }

        RasterImage source = decoded.getRaster();
        NormalizationResult normalized;
        BufferedImage preview;
        try {
            normalized = _normalizer.normalize(source, decoded.getTags());
            preview = ImageUtils.scaleToFit(RasterImages.toBufferedImage(normalized.getImage()),
                    _config.getPreviewMaxWidth(), _config.getPreviewMaxHeight());
        } catch (RuntimeException e) {
            log.error("Could not render a preview of {}", file.getName(), e);
            return ImageLoadResult.failed(file, String.valueOf(e.getMessage()));
        }

        String statusLine = String.format(Locale.ROOT, "%s (%d/%d) | Original: %dx%d | Display: %dx%d | %s | %.1f KB",
                file.getName(), _index + 1, _files.size(),
                source.getWidth(), source.getHeight(),
                preview.getWidth(), preview.getHeight(),
                normalized.getSourceFormat(),
                FileUtils.sizeOf(file) / 1024.0);
        return ImageLoadResult.loaded(file, preview, normalized, statusLine);
    }

    /**
     * Parse {@code text} as a date and write it into the current image. The text is remembered whatever the outcome.
     */
    public DateUpdateOutcome setDate(String text) {
        String input = StringUtils.trimToEmpty(text);
        _lastDateText = input;
        if (input.isEmpty()) {
            return DateUpdateOutcome.emptyInput();
        }

        Optional<LocalDateTime> date = _dateParser.parse(input);
        if (date.isEmpty()) {
            return DateUpdateOutcome.parseFailure(input);
        }

        File file = getCurrentFile();
        DateWriteResult result = _dateWriter.write(file, date.get());
        return DateUpdateOutcome.written(file.getName(), input, result);
    }

    public String getLastDateText() {
        return _lastDateText;
    }
}
