package com.augment.core;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A pixel buffer travelling through the augmentation pipeline, with a display name and an
 * append-only log of the operations applied to it.
 *
 * <p>Not thread-safe. An image is owned by exactly one thread at a time; ownership passes with
 * each queue hop and the sender must not touch the image after pushing it.
 *
 * <p>Ids come from a process-wide counter that starts at 0 and is never reset. They are unique
 * within one JVM and mean nothing across restarts; seeds are derived from {@link #name()}, never
 * from the id.
 */
public final class Image {
    private static final AtomicLong NEXT_ID = new AtomicLong();

    private final long id;
    private final String name;
    private final List<String> history = new ArrayList<>();
    private BufferedImage data;

    public Image(BufferedImage data, String name) {
        this.data = Objects.requireNonNull(data, "data");
        this.name = Objects.requireNonNull(name, "name");
        this.id = NEXT_ID.getAndIncrement();
    }

    public BufferedImage data() { return data; }

    public void setData(BufferedImage data) {
        this.data = Objects.requireNonNull(data, "data");
    }

    public long id() { return id; }

    public String name() { return name; }

    public int width() { return data.getWidth(); }

    public int height() { return data.getHeight(); }

    public void logOperation(String description) {
        history.add(Objects.requireNonNull(description, "description"));
    }

    /** Snapshot of the operation log, oldest first. */
    public List<String> history() {
        return List.copyOf(history);
    }

    @Override
    public String toString() {
        return "Image[id=" + id + ", name=" + name + ", " + data.getWidth() + "x" + data.getHeight() + "]";
    }
}
