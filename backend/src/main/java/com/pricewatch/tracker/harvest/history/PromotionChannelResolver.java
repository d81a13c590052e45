package com.pricewatch.tracker.harvest.history;

import com.pricewatch.tracker.harvest.model.ChannelObservation;
import com.pricewatch.tracker.harvest.model.ObservationMeta;
import com.pricewatch.tracker.harvest.model.PriceChannel;
import com.pricewatch.tracker.harvest.model.PriceInfo;
import com.pricewatch.tracker.harvest.model.ProductSnapshot;
import com.pricewatch.tracker.harvest.model.PromotionInfo;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits one catalog response into per-channel observations.
 * <p>
 * When several promotions qualify for the same channel the lowest price
 * wins, then the earliest start date, then the promotion id.
 */
public class PromotionChannelResolver {
    private static final Comparator<String> NULLS_LAST = Comparator.nullsLast(Comparator.naturalOrder());
    private static final Comparator<Candidate> PREFERENCE = Comparator
        .comparing((Candidate candidate) -> candidate.price)
        .thenComparing(candidate -> candidate.promotion.startDate(), NULLS_LAST)
        .thenComparing(candidate -> candidate.promotion.id(), NULLS_LAST);

    private final String loyaltyAttribute;
    private final Pattern descriptionPrice;

    public PromotionChannelResolver(String loyaltyAttribute, String currencySuffix) {
        this.loyaltyAttribute = loyaltyAttribute;
        String suffix = currencySuffix == null || currencySuffix.isBlank() ? "Ft" : currencySuffix.trim();
        this.descriptionPrice = Pattern.compile("(\\d+)" + Pattern.quote(suffix), Pattern.CASE_INSENSITIVE);
    }

    public List<ChannelObservation> resolve(ProductSnapshot snapshot) {
        List<ChannelObservation> observations = new ArrayList<>();
        PriceInfo price = snapshot.price();
        if (price == null || price.actual() == null) {
            return observations;
        }
        BigDecimal actual = price.actual();
        observations.add(new ChannelObservation(
            PriceChannel.NORMAL,
            actual,
            ObservationMeta.forUnit(price.unitPrice(), price.unitOfMeasure())
        ));

        List<Candidate> clubcard = new ArrayList<>();
        List<Candidate> discount = new ArrayList<>();
        for (PromotionInfo promotion : snapshot.promotions()) {
            if (promotion.hasAttribute(loyaltyAttribute)) {
                BigDecimal clubcardPrice = clubcardPrice(promotion, actual);
                if (clubcardPrice != null) {
                    clubcard.add(new Candidate(promotion, clubcardPrice));
                }
                continue;
            }
            BigDecimal afterDiscount = promotion.afterDiscount();
            if (afterDiscount != null && afterDiscount.compareTo(actual) != 0) {
                discount.add(new Candidate(promotion, afterDiscount));
            }
        }

        preferred(discount, PriceChannel.DISCOUNT, observations);
        preferred(clubcard, PriceChannel.CLUBCARD, observations);
        return observations;
    }

    BigDecimal clubcardPrice(PromotionInfo promotion, BigDecimal actual) {
        BigDecimal afterDiscount = promotion.afterDiscount();
        if (afterDiscount != null && (actual == null || afterDiscount.compareTo(actual) != 0)) {
            return afterDiscount;
        }
        BigDecimal parsed = parseDescriptionPrice(promotion.description());
        return parsed != null ? parsed : afterDiscount;
    }

    public BigDecimal parseDescriptionPrice(String description) {
        if (description == null || description.isBlank()) {
            return null;
        }
        String compact = description.replace("\u00A0", "").replace("\u202F", "").replace(" ", "");
        Matcher matcher = descriptionPrice.matcher(compact);
        if (!matcher.find()) {
            return null;
        }
        return new BigDecimal(matcher.group(1));
    }

    private void preferred(List<Candidate> candidates, PriceChannel channel, List<ChannelObservation> out) {
        candidates.stream()
            .min(PREFERENCE)
            .ifPresent(candidate -> out.add(new ChannelObservation(
                channel,
                candidate.price,
                ObservationMeta.forPromotion(candidate.promotion)
            )));
    }

    private static final class Candidate {
        private final PromotionInfo promotion;
        private final BigDecimal price;

        private Candidate(PromotionInfo promotion, BigDecimal price) {
            this.promotion = promotion;
            this.price = price;
        }
    }
}
