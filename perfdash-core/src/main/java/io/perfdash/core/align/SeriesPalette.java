package io.perfdash.core.align;

import java.util.List;

/**
 * Legend colors for compared devices.
 * <p>
 * A pure function of the device and its position in the request, so the same
 * device set always renders with the same colors.
 */
public final class SeriesPalette {

    static final List<String> COLORS = List.of(
            "rgb(75, 192, 192)",
            "rgb(255, 99, 132)",
            "rgb(54, 162, 235)",
            "rgb(255, 159, 64)",
            "rgb(153, 102, 255)",
            "rgb(255, 205, 86)",
            "rgb(201, 203, 207)"
    );

    private SeriesPalette() {}

    /**
     * @param deviceId device folder name
     * @param position zero-based position in the caller's device list; negative when unknown
     */
    public static String colorFor(String deviceId, int position) {
        int slot = position >= 0 ? position : deviceId.hashCode();
        return COLORS.get(Math.floorMod(slot, COLORS.size()));
    }

    /**
     * Translucent variant of a palette color, for filled areas.
     */
    public static String fillFor(String color) {
        return color.replace("rgb(", "rgba(").replace(")", ", 0.2)");
    }

    public static List<String> colors() {
        return COLORS;
    }

    public static int size() {
        return COLORS.size();
    }
}
