package dev.macros.coords;

import dev.macros.model.Region;

import java.util.Objects;

/**
 * Maps a worker's logical coordinates (script space, sized by the target's
 * resolution) onto its physical surface, and onto captured frames.
 *
 * <p>{@code scaleX = surface.width / resolution.width}, likewise for y. Scales are
 * recomputed only when the resolution or the surface changes. Confined to the
 * owning worker's thread.</p>
 */
public final class CoordinateMapper {

    private Resolution resolution;
    private Surface surface;
    private double scaleX;
    private double scaleY;

    public CoordinateMapper(Resolution resolution, Surface surface) {
        update(resolution, surface);
    }

    /**
     * Rebind to new inputs.
     *
     * @return true if the scale factors were recomputed
     */
    public boolean update(Resolution newResolution, Surface newSurface) {
        Objects.requireNonNull(newResolution, "resolution");
        Objects.requireNonNull(newSurface, "surface");
        if (newResolution.equals(resolution) && newSurface.equals(surface)) {
            return false;
        }
        this.resolution = newResolution;
        this.surface = newSurface;
        this.scaleX = (double) newSurface.width() / newResolution.width();
        this.scaleY = (double) newSurface.height() / newResolution.height();
        return true;
    }

    public Resolution resolution() { return resolution; }
    public Surface surface() { return surface; }
    public double scaleX() { return scaleX; }
    public double scaleY() { return scaleY; }

    /**
     * Physical position of a logical point: {@code origin + round(x * scale)}.
     *
     * @throws CoordinateOutOfRangeException unless {@code 0 <= x < width} and {@code 0 <= y < height}
     */
    public Point localToScreen(int x, int y) {
        checkBounds(x, y);
        return new Point(
            surface.originX() + (int) Math.round(x * scaleX),
            surface.originY() + (int) Math.round(y * scaleY));
    }

    /**
     * Pixel of a captured frame that shows the logical point. Frames may come at any
     * size (surface size, device resolution), so the frame's own size sets the scale.
     */
    public Point localToFrame(int x, int y, int frameWidth, int frameHeight) {
        checkBounds(x, y);
        return new Point(
            (int) ((long) x * frameWidth / resolution.width()),
            (int) ((long) y * frameHeight / resolution.height()));
    }

    /**
     * Inverse of {@link #localToFrame}: the logical pixel covering a frame pixel.
     * Floors, so any pixel inside the frame lands inside the logical bounds.
     */
    public Point frameToLocal(int frameX, int frameY, int frameWidth, int frameHeight) {
        return new Point(
            (int) ((long) frameX * resolution.width() / frameWidth),
            (int) ((long) frameY * resolution.height() / frameHeight));
    }

    /**
     * Frame-space rectangle covering a logical region. The region's exclusive end may
     * equal the logical width/height; it may not exceed it.
     */
    public Region localRegionToFrame(Region region, int frameWidth, int frameHeight) {
        checkBounds(region.x1(), region.y1());
        if (region.x2() > resolution.width() || region.y2() > resolution.height()) {
            throw new CoordinateOutOfRangeException("Region (%d,%d)-(%d,%d) exceeds logical bounds %s"
                .formatted(region.x1(), region.y1(), region.x2(), region.y2(), resolution));
        }
        Point start = localToFrame(region.x1(), region.y1(), frameWidth, frameHeight);
        int x2 = Math.max(start.x() + 1, (int) Math.round((double) region.x2() * frameWidth / resolution.width()));
        int y2 = Math.max(start.y() + 1, (int) Math.round((double) region.y2() * frameHeight / resolution.height()));
        return new Region(start.x(), start.y(), Math.min(x2, frameWidth), Math.min(y2, frameHeight));
    }

    private void checkBounds(int x, int y) {
        if (x < 0 || x >= resolution.width() || y < 0 || y >= resolution.height()) {
            throw new CoordinateOutOfRangeException(
                "Logical point (%d,%d) outside %s".formatted(x, y, resolution));
        }
    }
}
