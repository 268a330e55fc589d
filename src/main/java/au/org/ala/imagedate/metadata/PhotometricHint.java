package au.org.ala.imagedate.metadata;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Display hints read from an image's tags before any pixel conversion runs. Immutable.
 */
public final class PhotometricHint {

    public static final Orientation DEFAULT_ORIENTATION = Orientation.Normal;
    public static final boolean DEFAULT_WHITE_IS_ZERO = false;

    /** Upright, BlackIsZero, no declared sample range. */
    public static final PhotometricHint DEFAULT = new PhotometricHint(DEFAULT_ORIENTATION, DEFAULT_WHITE_IS_ZERO,
            OptionalDouble.empty(), OptionalDouble.empty());

    private final Orientation orientation;
    private final boolean whiteIsZero;
    private final OptionalDouble declaredMin;
    private final OptionalDouble declaredMax;

    private PhotometricHint(Orientation orientation, boolean whiteIsZero, OptionalDouble declaredMin, OptionalDouble declaredMax) {
        Preconditions.checkArgument(declaredMin.isPresent() == declaredMax.isPresent(),
                "Declared sample bounds must be both present or both absent");
        this.orientation = Objects.requireNonNull(orientation, "orientation");
        this.whiteIsZero = whiteIsZero;
        this.declaredMin = declaredMin;
        this.declaredMax = declaredMax;
    }

    public static PhotometricHint of(Orientation orientation, boolean whiteIsZero) {
        return new PhotometricHint(orientation, whiteIsZero, OptionalDouble.empty(), OptionalDouble.empty());
    }

    public static PhotometricHint of(Orientation orientation, boolean whiteIsZero, double declaredMin, double declaredMax) {
        return new PhotometricHint(orientation, whiteIsZero, OptionalDouble.of(declaredMin), OptionalDouble.of(declaredMax));
    }

    public Orientation getOrientation() {
        return orientation;
    }

    public boolean isWhiteIsZero() {
        return whiteIsZero;
    }

    /**
     * @return the declared minimum sample value; present exactly when {@link #getDeclaredMax()} is
     */
    public OptionalDouble getDeclaredMin() {
        return declaredMin;
    }

    public OptionalDouble getDeclaredMax() {
        return declaredMax;
    }

    public boolean hasDeclaredRange() {
        return declaredMin.isPresent();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PhotometricHint that = (PhotometricHint) o;
        return whiteIsZero == that.whiteIsZero && orientation == that.orientation
                && declaredMin.equals(that.declaredMin) && declaredMax.equals(that.declaredMax);
    }

    @Override
    public int hashCode() {
        return Objects.hash(orientation, whiteIsZero, declaredMin, declaredMax);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("orientation", orientation)
                .add("whiteIsZero", whiteIsZero)
                .add("declaredMin", declaredMin)
                .add("declaredMax", declaredMax)
                .toString();
    }
}
