package com.aerox.orchestrator.narrator;

import com.aerox.common.model.BookingRequest;
import com.aerox.common.model.CreditOption;
import com.aerox.common.model.CustomerMessage;

import java.util.ArrayList;
import java.util.List;

import static com.aerox.common.options.OptionsGenerator.money;

/**
 * Deterministic customer messages, used whenever the narrator cannot produce one.
 * Every figure comes from the verified options.
 */
public final class MessageTemplates {

    public static final String SUPPORT_LABEL = "Support";

    private MessageTemplates() {}

    public static String subject(BookingRequest booking) {
        return "Credit Options for ₹" + money(booking.bookingAmount()) + " Booking";
    }

    /** {@code Select A}, {@code Select B}, ... one per option, then {@code Support}. */
    public static List<String> callToActionLabels(List<CreditOption> options) {
        List<String> labels = new ArrayList<>(options.size() + 1);
        for (CreditOption option : options) {
            labels.add("Select " + option.optionId());
        }
        labels.add(SUPPORT_LABEL);
        return labels;
    }

    public static CustomerMessage decisionMessage(DecisionNarrationContext context) {
        BookingRequest booking = context.booking();
        StringBuilder body = new StringBuilder();

        body.append("Hi ").append(booking.companyName()).append(",\n\n");
        body.append("Your ₹").append(money(booking.bookingAmount())).append(" booking");
        if (booking.route() != null && !booking.route().isBlank()) {
            body.append(" (").append(booking.route()).append(')');
        }
        body.append(" is ready! ");
        double shortfall = booking.creditLimitShortfall();
        if (shortfall > 0) {
            body.append("It exceeds your available credit by ₹").append(money(shortfall)).append(". ");
        }
        body.append("We can approve it with one of these options:\n\n");

        for (CreditOption option : context.options()) {
            body.append(describe(option)).append("\n\n");
        }

        body.append("Reply ").append(replyChoices(context.options())).append(" to proceed.\n");
        body.append("Need help? Tap 'Support' below.\n\n");
        body.append("AEROX Credit Team");

        return new CustomerMessage(subject(booking), body.toString(), callToActionLabels(context.options()));
    }

    static String describe(CreditOption option) {
        String head = "*Option " + option.optionId() + "* ";
        return switch (option.kind()) {
            case SHORTENED_SETTLEMENT -> head + "⚡ Recommended\n"
                + "Settle within " + option.settlementDays() + " days (no upfront)\n"
                + "→ Full ₹" + money(option.approvedAmount()) + " approved";
            case UPFRONT_PAYMENT -> head + "📅 Standard timeline\n"
                + "Pay ₹" + money(option.upfrontAmount()) + " upfront\n"
                + "→ Remaining ₹" + money(option.approvedAmount() - option.upfrontAmount())
                + " in " + option.settlementDays() + " days";
            case PARTIAL_APPROVAL -> head + "💰 Reduced amount\n"
                + "Approve ₹" + money(option.approvedAmount()) + " with "
                + option.settlementDays() + "-day settlement\n"
                + "→ Request more credit later";
        };
    }

    private static String replyChoices(List<CreditOption> options) {
        List<String> ids = options.stream().map(CreditOption::optionId).toList();
        if (ids.size() == 1) return ids.get(0);
        return String.join(", ", ids.subList(0, ids.size() - 1)) + " or " + ids.get(ids.size() - 1);
    }
}
