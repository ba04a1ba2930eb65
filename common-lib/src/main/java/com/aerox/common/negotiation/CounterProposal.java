package com.aerox.common.negotiation;

/**
 * Raw narrator reply to a customer message.
 *
 * @param responseText text to show the customer if the offer survives verification
 * @param offer        suggested terms, or null when the narrator proposed none
 * @param escalateHint narrator's own opinion that the case should go to manual review; advisory only
 */
public record CounterProposal(String responseText, ProposedTerms offer, boolean escalateHint) {}
