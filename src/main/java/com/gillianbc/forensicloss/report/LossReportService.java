package com.gillianbc.forensicloss.report;

import com.gillianbc.forensicloss.model.AuditEntry;
import com.gillianbc.forensicloss.model.CaseConfig;
import com.gillianbc.forensicloss.model.CaseResult;
import com.gillianbc.forensicloss.model.CaseSummary;
import com.gillianbc.forensicloss.model.Decimals;
import com.gillianbc.forensicloss.model.DiscountFactorSchedule.DiscountFactor;
import com.gillianbc.forensicloss.model.EarningsSchedule.EarningsYear;
import com.gillianbc.forensicloss.model.GrowthSchedule.GrowthYear;
import com.gillianbc.forensicloss.model.LifeExpectancyResult;
import com.gillianbc.forensicloss.model.LifeExpectancyResult.InterpolationRow;
import com.gillianbc.forensicloss.model.PresentValueResult.PresentValueYear;
import com.gillianbc.forensicloss.model.WageHistory;
import com.gillianbc.forensicloss.model.WageHistory.WageYear;
import com.gillianbc.forensicloss.model.WorkLifeResult;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Renders a case result as a single HTML document with one section per report sheet:
 * dashboard, life_expectancy, worklife_lookup, wage_growth, projections, discount_factors,
 * present_value and audit_log.
 * <p>
 * This is the only place where figures are rounded.
 */
@Service
public class LossReportService {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public String renderHtml(CaseResult result) {
        CaseConfig config = result.getConfig();
        CaseSummary summary = result.summary();

        StringBuilder html = new StringBuilder();
        html.append("<!DOCTYPE html>\n")
            .append("<html lang=\"en\">\n")
            .append("<head>\n")
            .append("    <meta charset=\"UTF-8\">\n")
            .append("    <title>Forensic Economic Loss Analysis - ").append(escape(config.getCaseId())).append("</title>\n")
            .append("    <style>\n")
            .append("        body { font-family: Arial, sans-serif; margin: 20px; background-color: #f5f5f5; }\n")
            .append("        .container { max-width: 1200px; margin: 0 auto; background-color: white; padding: 20px; border-radius: 8px; box-shadow: 0 2px 4px rgba(0,0,0,0.1); }\n")
            .append("        h1 { color: #2c3e50; text-align: center; margin-bottom: 30px; }\n")
            .append("        h2 { color: #2c3e50; margin-top: 24px; }\n")
            .append("        .summary { background-color: #ecf0f1; padding: 15px; border-radius: 5px; margin-bottom: 30px; }\n")
            .append("        .summary p { margin: 8px 0; font-size: 16px; }\n")
            .append("        table { width: 100%; border-collapse: collapse; margin-top: 10px; }\n")
            .append("        th, td { border: 1px solid #ddd; padding: 8px; text-align: right; }\n")
            .append("        td.text { text-align: left; }\n")
            .append("        th { background-color: #3498db; color: white; font-weight: bold; }\n")
            .append("        tr:nth-child(even) { background-color: #f2f2f2; }\n")
            .append("        .currency { font-family: 'Courier New', monospace; }\n")
            .append("        .total { font-weight: bold; }\n")
            .append("    </style>\n")
            .append("</head>\n")
            .append("<body>\n")
            .append("    <div class=\"container\">\n")
            .append("        <h1>Forensic Economic Loss Analysis</h1>\n");

        appendDashboard(html, result, summary);
        appendLifeExpectancy(html, result.getLifeExpectancy());
        appendWorkLife(html, result.getWorkLife());
        appendWageGrowth(html, result);
        appendProjections(html, result);
        appendDiscountFactors(html, result);
        appendPresentValue(html, result);
        appendAuditLog(html, result);

        html.append("    </div>\n")
            .append("</body>\n")
            .append("</html>\n");
        return html.toString();
    }

    private void appendDashboard(StringBuilder html, CaseResult result, CaseSummary summary) {
        CaseConfig config = result.getConfig();
        html.append("        <div class=\"summary\" id=\"dashboard\">\n")
            .append("            <h2>Dashboard</h2>\n")
            .append("            <p><strong>Case ID:</strong> ").append(escape(config.getCaseId())).append("</p>\n")
            .append("            <p><strong>Person:</strong> ").append(escape(config.getPerson().fullName())).append("</p>\n")
            .append("            <p><strong>Sex:</strong> ").append(config.getPerson().getSex().getCode())
            .append(", <strong>DOB:</strong> ").append(config.getPerson().getDateOfBirth())
            .append(", <strong>Evaluation date:</strong> ").append(config.getPerson().getEvaluationDate()).append("</p>\n")
            .append("            <p><strong>Occupation:</strong> ").append(escape(config.getOccupation().getTitle()))
            .append(" (SOC ").append(escape(config.getOccupation().getSocCode())).append("), ")
            .append(escape(config.getOccupation().location())).append("</p>\n")
            .append("            <p><strong>Base salary:</strong> $").append(money(config.getOccupation().getBaseSalary())).append("</p>\n")
            .append("            <p><strong>Age at evaluation:</strong> ").append(decimal(result.getAgeAtEvaluation(), 2)).append("</p>\n")
            .append("            <p><strong>Life expectancy (years):</strong> ").append(decimal(summary.lifeExpectancyYears(), 2)).append("</p>\n")
            .append("            <p><strong>Work-life remaining (years):</strong> ").append(decimal(summary.worklifeRemainingYears(), 2)).append("</p>\n")
            .append("            <p><strong>Average wage growth:</strong> ").append(decimal(summary.avgWageGrowthPct(), 2)).append("%</p>\n")
            .append("            <p><strong>Discount rate:</strong> ").append(decimal(summary.discountRatePct(), 2)).append("%</p>\n")
            .append("            <p class=\"total\"><strong>Total economic loss:</strong> $").append(money(summary.totalEconomicLossUsd())).append("</p>\n")
            .append("        </div>\n");
    }

    private void appendLifeExpectancy(StringBuilder html, LifeExpectancyResult lifeExpectancy) {
        openSection(html, "life_expectancy", "Life Expectancy", "Age", "Remaining years", "Weight", "Source");
        if (lifeExpectancy.isOverridden()) {
            row(html, decimal(lifeExpectancy.getAge(), 4), decimal(lifeExpectancy.getRemainingYears(), 2), "1",
                    text(lifeExpectancy.getCitation().sourceLabel()));
        }
        for (InterpolationRow row : lifeExpectancy.getRows()) {
            row(html, String.valueOf(row.age()), decimal(row.remainingYears(), 2), decimal(row.weight(), 4),
                    text(row.citation().locator()));
        }
        html.append("                <tr class=\"total\"><td>").append(decimal(lifeExpectancy.getAge(), 4))
            .append("</td><td>").append(decimal(lifeExpectancy.getRemainingYears(), 2))
            .append("</td><td></td><td class=\"text\">resolved</td></tr>\n");
        closeSection(html);
    }

    private void appendWorkLife(StringBuilder html, WorkLifeResult workLife) {
        openSection(html, "worklife_lookup", "Work-Life Expectancy", "Basis", "Participation factor",
                "Life expectancy (years)", "Work-life (years)", "Clamped", "Source");
        String factor = workLife.getParticipationFactor() == null ? "" : decimal(workLife.getParticipationFactor(), 4);
        String source = workLife.getCitation() == null ? "" : workLife.getCitation().locator();
        row(html, text(workLife.getBasis().name()), factor, decimal(workLife.getLifeExpectancyYears(), 2),
                decimal(workLife.getWorkLifeYears(), 2), workLife.isClamped() ? "yes" : "no", text(source));
        closeSection(html);
    }

    private void appendWageGrowth(StringBuilder html, CaseResult result) {
        openSection(html, "wage_growth", "Wage Growth", "Year index", "Calendar year", "Growth rate (%)", "Carried forward");
        for (GrowthYear year : result.getGrowthSchedule().getYears()) {
            row(html, String.valueOf(year.yearIndex()), String.valueOf(year.calendarYear()),
                    decimal(year.rate().multiply(HUNDRED), 2), year.carriedForward() ? "yes" : "no");
        }
        closeSection(html);

        WageHistory history = result.wageHistory();
        openSection(html, "wage_history", "Historical Mean Wage (reconstructed at "
                + decimal(history.getGrowthRate().multiply(HUNDRED), 2) + "%)", "Year", "Mean wage", "YoY growth (%)");
        for (WageYear year : history.getYears()) {
            row(html, String.valueOf(year.year()), currency(year.meanWage()),
                    year.yoyGrowth() == null ? "" : decimal(year.yoyGrowth().multiply(HUNDRED), 2));
        }
        closeSection(html);
    }

    private void appendProjections(StringBuilder html, CaseResult result) {
        openSection(html, "projections", "Earnings Projections", "Year index", "Calendar year", "Full year value",
                "Portion of year", "Actual value");
        for (EarningsYear year : result.getEarnings().getYears()) {
            row(html, String.valueOf(year.yearIndex()), String.valueOf(year.calendarYear()),
                    currency(year.fullYearEarnings()), decimal(year.yearFraction(), 4), currency(year.nominalEarnings()));
        }
        closeSection(html);
    }

    private void appendDiscountFactors(StringBuilder html, CaseResult result) {
        openSection(html, "discount_factors", "Discount Factors (rate "
                + decimal(result.getDiscountFactors().getRate().multiply(HUNDRED), 2) + "%)", "Year index", "Discount factor");
        for (DiscountFactor factor : result.getDiscountFactors().getFactors()) {
            row(html, String.valueOf(factor.yearIndex()), decimal(factor.factor(), 6));
        }
        closeSection(html);
    }

    private void appendPresentValue(StringBuilder html, CaseResult result) {
        openSection(html, "present_value", "Present Value", "Year index", "Actual value", "Discount factor",
                "Present value", "Cumulative present value");
        for (PresentValueYear year : result.getPresentValue().getYears()) {
            row(html, String.valueOf(year.yearIndex()), currency(year.nominalEarnings()), decimal(year.discountFactor(), 6),
                    currency(year.presentValue()), currency(year.cumulativePresentValue()));
        }
        html.append("                <tr class=\"total\"><td colspan=\"4\">Total economic loss</td><td class=\"currency\">$")
            .append(money(result.getTotalLoss())).append("</td></tr>\n");
        closeSection(html);
    }

    private void appendAuditLog(StringBuilder html, CaseResult result) {
        openSection(html, "audit_log", "Audit Log", "#", "Stage", "Description", "Value", "Source", "Locator");
        int n = 1;
        for (AuditEntry entry : result.getAuditEntries()) {
            row(html, String.valueOf(n++), text(entry.stage().getLabel()), text(entry.description()),
                    entry.value().toPlainString(), text(entry.sourceLabel()), text(entry.sourceLocator()));
        }
        closeSection(html);
    }

    private static void openSection(StringBuilder html, String id, String title, String... headings) {
        html.append("        <h2 id=\"").append(id).append("\">").append(escape(title)).append("</h2>\n")
            .append("        <table class=\"").append(id).append("\">\n")
            .append("            <thead>\n")
            .append("                <tr>\n");
        for (String heading : headings) {
            html.append("                    <th>").append(escape(heading)).append("</th>\n");
        }
        html.append("                </tr>\n")
            .append("            </thead>\n")
            .append("            <tbody>\n");
    }

    private static void closeSection(StringBuilder html) {
        html.append("            </tbody>\n")
            .append("        </table>\n");
    }

    // Cells are pre-formatted; text(...) and currency(...) mark their own alignment
    private static void row(StringBuilder html, String... cells) {
        html.append("                <tr>");
        for (String cell : cells) {
            if (cell.startsWith("<td")) {
                html.append(cell);
            } else {
                html.append("<td>").append(cell).append("</td>");
            }
        }
        html.append("</tr>\n");
    }

    private static String text(String value) {
        return "<td class=\"text\">" + escape(value) + "</td>";
    }

    private static String currency(BigDecimal value) {
        return "<td class=\"currency\">$" + money(value) + "</td>";
    }

    static String money(BigDecimal value) {
        return String.format(Locale.US, "%,.2f", value.setScale(Decimals.CURRENCY_SCALE, Decimals.REPORT_ROUNDING));
    }

    static String decimal(BigDecimal value, int scale) {
        return value.setScale(scale, RoundingMode.HALF_UP).toPlainString();
    }

    static String escape(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }
}
