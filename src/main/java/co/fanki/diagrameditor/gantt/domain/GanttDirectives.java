package co.fanki.diagrameditor.gantt.domain;

import java.util.List;

/**
 * Chart-wide settings declared by directive lines.
 *
 * @param title the chart title, empty when absent
 * @param dateFormat the input date format, {@code YYYY-MM-DD} by default
 * @param axisFormat the axis label format, null when absent
 * @param tickInterval the axis tick interval, null when absent
 * @param todayMarker the today marker setting, {@code on} by default
 * @param excludes the excluded days, lower-cased
 * @param weekend the first weekend day, lower-cased, null when absent
 * @param displayMode the display mode, null when absent
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record GanttDirectives(
        String title,
        String dateFormat,
        String axisFormat,
        String tickInterval,
        String todayMarker,
        List<String> excludes,
        String weekend,
        String displayMode) {

    /** Format assumed when the chart declares none. */
    public static final String DEFAULT_DATE_FORMAT = "YYYY-MM-DD";

    /**
     * Directives of a chart that declares none.
     *
     * @return the defaults
     */
    public static GanttDirectives defaults() {
        return new GanttDirectives("", DEFAULT_DATE_FORMAT, null, null, "on",
                List.of(), null, null);
    }

}
