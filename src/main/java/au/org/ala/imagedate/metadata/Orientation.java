package au.org.ala.imagedate.metadata;

import java.awt.geom.AffineTransform;

/**
 * The eight EXIF orientations. Constant names follow the javax.imageio standard metadata format, values the TIFF
 * Orientation tag (274).
 * <p/>
 * {@link #getAffineTransform(int, int)} maps stored image coordinates onto upright display coordinates, pixel corners
 * at integer positions.
 */
public enum Orientation {
    Normal(1, false) {
        @Override
        public AffineTransform getAffineTransform(int width, int height) {
            return new AffineTransform();
        }
    },
    FlipH(2, false) {
        @Override
        public AffineTransform getAffineTransform(int width, int height) {
            return new AffineTransform(-1, 0, 0, 1, width, 0);
        }
    },
    Rotate180(3, false) {
        @Override
        public AffineTransform getAffineTransform(int width, int height) {
            return new AffineTransform(-1, 0, 0, -1, width, height);
        }
    },
    FlipV(4, false) {
        @Override
        public AffineTransform getAffineTransform(int width, int height) {
            return new AffineTransform(1, 0, 0, -1, 0, height);
        }
    },
    // transpose
    FlipVRotate90(5, true) {
        @Override
        public AffineTransform getAffineTransform(int width, int height) {
            return new AffineTransform(0, 1, 1, 0, 0, 0);
        }
    },
    // stored rotated 90 degrees counter-clockwise, displayed by turning it clockwise
    Rotate270(6, true) {
        @Override
        public AffineTransform getAffineTransform(int width, int height) {
            return new AffineTransform(0, 1, -1, 0, height, 0);
        }
    },
    // transverse
    FlipHRotate90(7, true) {
        @Override
        public AffineTransform getAffineTransform(int width, int height) {
            return new AffineTransform(0, -1, -1, 0, height, width);
        }
    },
    Rotate90(8, true) {
        @Override
        public AffineTransform getAffineTransform(int width, int height) {
            return new AffineTransform(0, -1, 1, 0, 0, width);
        }
    };

    private final int value; // TIFF Orientation (274) value
    private final boolean flipDimensions;

    Orientation(int value, boolean flipDimensions) {
        this.value = value;
        this.flipDimensions = flipDimensions;
    }

    /**
     * @param width stored image width
     * @param height stored image height
     * @return the transform from stored to upright coordinates
     */
    public abstract AffineTransform getAffineTransform(int width, int height);

    public int value() {
        return value;
    }

    /**
     * @return true when width and height swap once the orientation is applied
     */
    public boolean isFlipDimensions() {
        return flipDimensions;
    }

    public static Orientation fromMetadataOrientation(final String orientationName) {
        if (orientationName != null) {
            for (Orientation orientation : values()) {
                if (orientation.name().equalsIgnoreCase(orientationName.trim())) {
                    return orientation;
                }
            }
        }
        return Normal;
    }

    public static Orientation fromExifOrientation(final int orientation) {
        for (Orientation o : values()) {
            if (o.value == orientation) {
                return o;
            }
        }
        return Normal;
    }
}
