package au.org.ala.imagedate.util;

import org.apache.commons.io.FilenameUtils;
import org.apache.commons.io.IOCase;
import org.apache.commons.io.filefilter.FileFileFilter;
import org.apache.commons.io.filefilter.FileFilterUtils;
import org.apache.commons.io.filefilter.IOFileFilter;
import org.apache.commons.io.filefilter.SuffixFileFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Lists the image files of a folder by extension, case-insensitively.
 */
public class ImageFileEnumerator {

    private static final Logger log = LoggerFactory.getLogger(ImageFileEnumerator.class);

    public static final List<String> DEFAULT_EXTENSIONS = List.of("jpg", "jpeg", "png", "tif", "tiff", "bmp", "gif");

    private final List<String> extensions;
    private final IOFileFilter filter;

    public ImageFileEnumerator() {
        this(DEFAULT_EXTENSIONS);
    }

    public ImageFileEnumerator(List<String> extensions) {
        this.extensions = extensions.stream().map(e -> e.toLowerCase(Locale.ROOT)).collect(Collectors.toList());
        String[] suffixes = this.extensions.stream().map(e -> "." + e).toArray(String[]::new);
        this.filter = FileFilterUtils.and(FileFileFilter.INSTANCE, new SuffixFileFilter(suffixes, IOCase.INSENSITIVE));
    }

    /**
     * @return the image files directly inside {@code folder}, sorted by name; empty if the folder can't be listed
     */
    public List<File> listImages(File folder) {
        File[] files = folder.listFiles((java.io.FileFilter) filter);
        if (files == null) {
            log.warn("Unable to list {}", folder);
            return List.of();
        }
        return Arrays.stream(files)
                .sorted(Comparator.comparing(File::getName, String.CASE_INSENSITIVE_ORDER))
                .collect(Collectors.toList());
    }

    public boolean isImage(String filename) {
        return extensions.contains(FilenameUtils.getExtension(filename).toLowerCase(Locale.ROOT));
    }

    public List<String> getExtensions() {
        return extensions;
    }
}
