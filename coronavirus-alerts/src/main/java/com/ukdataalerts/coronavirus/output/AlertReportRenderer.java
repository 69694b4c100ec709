package com.ukdataalerts.coronavirus.output;

import com.ukdataalerts.coronavirus.config.AlertsProperties;
import com.ukdataalerts.coronavirus.model.AreaResult;
import com.ukdataalerts.coronavirus.model.CheckResult;
import com.ukdataalerts.coronavirus.model.ComparisonWindow;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Builds the HTML bodies of the two alert e-mails.
 */
@Component
@RequiredArgsConstructor
public class AlertReportRenderer {

    public static final String THRESHOLD_SUBJECT = "UK Coronavirus Data Alert";
    public static final String NEW_METRICS_SUBJECT = "[UK Coronavirus Data Alert] New metrics available";

    private final AlertsProperties properties;

    public String renderNewMetrics(Collection<String> identifiers) {
        StringBuilder html = new StringBuilder();
        html.append("<p>\n    New metrics available:\n    <ul>\n");
        for (String identifier : identifiers) {
            html.append("        <li>").append(escape(identifier)).append("</li>\n");
        }
        html.append("    </ul>\n</p>\n");
        appendDashboardLink(html);
        return html.toString();
    }

    /**
     * @param results only those with alerts are rendered, one table each
     */
    public String renderThresholdAlert(List<CheckResult> results) {
        StringBuilder html = new StringBuilder();
        html.append("<p>Some metrics have exceeded ")
                .append(BigDecimal.valueOf(properties.getThresholds().getPercentageChange())
                        .stripTrailingZeros().toPlainString())
                .append("% change week on week:</p>\n");

        for (CheckResult result : results) {
            if (result.hasAlerts()) {
                html.append("<p>").append(renderTable(result)).append("</p>\n");
            }
        }
        appendDashboardLink(html);
        return html.toString();
    }

    String renderTable(CheckResult result) {
        ComparisonWindow window = result.getWindow();
        boolean rateColumn = result.getAlerts().stream().anyMatch(AreaResult::isRateColumn);

        StringBuilder html = new StringBuilder();
        html.append("<h3>").append(escape(result.getCheck().getMetric()))
                .append(" (").append(escape(result.getCheck().getAreaType())).append(")</h3>\n");
        html.append("<table border=\"1\">\n<thead><tr>")
                .append(th("areaName"))
                .append(th(window.priorLabel()))
                .append(th(window.currentLabel()))
                .append(th("percentageChange"));
        if (rateColumn) {
            html.append(th("lastSevenDaysPer100000"));
        }
        html.append("</tr></thead>\n<tbody>\n");

        for (AreaResult row : result.getAlerts()) {
            html.append("<tr>")
                    .append(td(escape(row.getAreaName())))
                    .append(td(formatNumber(row.getPriorAggregate())))
                    .append(td(formatNumber(row.getCurrentAggregate())))
                    .append(td(formatNumber(row.roundedPercentageChange())));
            if (rateColumn) {
                Double rate = row.roundedPer100000Rate();
                html.append(td(rate == null ? "n/a" : formatNumber(rate)));
            }
            html.append("</tr>\n");
        }
        html.append("</tbody>\n</table>");
        return html.toString();
    }

    static String formatNumber(double value) {
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        return String.format(Locale.UK, "%.1f", value);
    }

    private void appendDashboardLink(StringBuilder html) {
        html.append("<p>\n    Check ").append(escape(properties.getApi().getDashboardUrl())).append("\n</p>\n");
    }

    private static String th(String text) {
        return "<th>" + escape(text) + "</th>";
    }

    private static String td(String html) {
        return "<td>" + html + "</td>";
    }

    private static String escape(String text) {
        return text == null ? "" : HtmlUtils.htmlEscape(text);
    }
}
