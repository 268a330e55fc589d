package au.org.ala.imagedate.util;

import org.imgscalr.Scalr;

import java.awt.image.BufferedImage;

public class ImageUtils {

    /**
     * Shrink an image to fit inside a bounding box, keeping its aspect ratio. Images that already fit are returned
     * as is.
     */
    public static BufferedImage scaleToFit(BufferedImage src, int maxWidth, int maxHeight) {
        double ratio = Math.min((double) maxWidth / src.getWidth(), (double) maxHeight / src.getHeight());
        if (ratio >= 1.0) {
            return src;
        }
        int destWidth = Math.max(1, (int) Math.round(src.getWidth() * ratio));
        int destHeight = Math.max(1, (int) Math.round(src.getHeight() * ratio));
        return Scalr.resize(src, Scalr.Method.QUALITY, Scalr.Mode.FIT_EXACT, destWidth, destHeight, Scalr.OP_ANTIALIAS);
    }

}
