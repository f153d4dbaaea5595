package io.tsadaash.periodicity.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.tsadaash.periodicity.Periodicity;
import io.tsadaash.periodicity.PeriodicityException;
import io.tsadaash.periodicity.model.DayConstraint;
import io.tsadaash.periodicity.model.MonthConstraint;
import io.tsadaash.periodicity.model.NthWeekday;
import io.tsadaash.periodicity.model.OrdinalPosition;
import io.tsadaash.periodicity.model.PeriodicityConstraints;
import io.tsadaash.periodicity.model.PeriodicityData;
import io.tsadaash.periodicity.model.RepetitionUnit;
import io.tsadaash.periodicity.model.SpecialPattern;
import io.tsadaash.periodicity.model.Timeframe;
import io.tsadaash.periodicity.model.WeekConstraint;
import io.tsadaash.periodicity.model.YearConstraint;
import io.tsadaash.periodicity.validation.ValidationError.InvalidValue;
import io.tsadaash.periodicity.validation.ValidationError.MissingRequired;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes periodicities as tagged-union JSON and decodes them back.
 *
 * <p>Example encoding:
 *
 * <pre>{@code
 * {
 *   "rep_unit": "day",
 *   "rep_per_unit": 1,
 *   "constraints": {
 *     "day": {"type": "days_of_month_from_start", "offsets": [12, 23]},
 *     "month": {"type": "months", "months": ["january", "february"]}
 *   },
 *   "week_start": "monday",
 *   "year_start": "january"
 * }
 * }</pre>
 *
 * <p>Offsets are stored 0-indexed. Absent calendar settings decode to their defaults. Every decoded
 * value is validated again through {@link Periodicity#of}.
 */
public final class PeriodicityCodec {
  private static final Logger log = LoggerFactory.getLogger(PeriodicityCodec.class);

  private final ObjectMapper mapper;

  public PeriodicityCodec() {
    this(new ObjectMapper());
  }

  public PeriodicityCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  /**
   * Encodes a periodicity as a JSON string.
   *
   * @param periodicity the periodicity
   * @return the JSON text
   */
  public String toJson(Periodicity periodicity) {
    try {
      return mapper.writeValueAsString(toTree(periodicity));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("failed to write periodicity tree", e);
    }
  }

  /**
   * Encodes a periodicity as a JSON tree.
   *
   * @param periodicity the periodicity
   * @return the JSON object
   */
  public ObjectNode toTree(Periodicity periodicity) {
    PeriodicityData data = Objects.requireNonNull(periodicity, "periodicity").data();
    ObjectNode root = mapper.createObjectNode();

    root.put("rep_unit", data.repUnit().value());
    if (data.repPerUnit() != null) {
      root.put("rep_per_unit", data.repPerUnit());
    }

    PeriodicityConstraints c = data.constraints();
    if (!c.isEmpty()) {
      ObjectNode constraints = root.putObject("constraints");
      if (c.day() != null) {
        constraints.set("day", encodeDay(c.day()));
      }
      if (c.week() != null) {
        constraints.set("week", encodeWeek(c.week()));
      }
      if (c.month() != null) {
        constraints.set("month", encodeMonth(c.month()));
      }
      if (c.year() != null) {
        constraints.set("year", encodeYear(c.year()));
      }
    }

    if (data.timeframe() != null) {
      ObjectNode timeframe = root.putObject("timeframe");
      if (data.timeframe().start() != null) {
        timeframe.put("start", data.timeframe().start().toString());
      }
      if (data.timeframe().end() != null) {
        timeframe.put("end", data.timeframe().end().toString());
      }
    }

    root.put("week_start", lower(data.weekStart()));
    root.put("year_start", lower(data.yearStart()));

    if (data.specialPattern() != null) {
      root.set("special_pattern", encodeSpecial(data.specialPattern()));
    }
    if (data.anchor() != null) {
      root.put("anchor", data.anchor().toString());
    }
    return root;
  }

  /**
   * Decodes and validates a periodicity from JSON text.
   *
   * @param json the JSON text
   * @return the validated periodicity
   * @throws PeriodicityException if the text is malformed or the decoded value is invalid
   */
  public Periodicity fromJson(String json) throws PeriodicityException {
    Objects.requireNonNull(json, "json");
    JsonNode root;
    try {
      root = mapper.readTree(json);
    } catch (JsonProcessingException e) {
      log.debug("Malformed periodicity JSON: {}", e.getOriginalMessage());
      throw new PeriodicityException(
          new InvalidValue("json", abbreviate(json), e.getOriginalMessage()), e);
    }
    return fromTree(root);
  }

  /**
   * Decodes and validates a periodicity from a JSON tree.
   *
   * @param root the JSON object
   * @return the validated periodicity
   * @throws PeriodicityException if the tree is malformed or the decoded value is invalid
   */
  public Periodicity fromTree(JsonNode root) throws PeriodicityException {
    PeriodicityData data;
    try {
      data = decode(root);
    } catch (PeriodicityException e) {
      log.debug("Undecodable periodicity: {}", e.getMessage());
      throw e;
    }
    return Periodicity.of(data);
  }

  // Encoding

  private ObjectNode encodeDay(DayConstraint day) {
    ObjectNode node = tagged(day.kind().tag());
    switch (day.kind()) {
      case EVERY_DAY -> {}
      case EVERY_N_DAYS -> node.put("interval", day.interval());
      case DAYS_OF_WEEK -> {
        ArrayNode weekdays = node.putArray("weekdays");
        day.weekdays().forEach(d -> weekdays.add(lower(d)));
      }
      case DAYS_OF_MONTH_FROM_START, DAYS_OF_MONTH_FROM_END -> {
        ArrayNode offsets = node.putArray("offsets");
        day.offsets().forEach(o -> offsets.add(o.intValue()));
      }
      case NTH_WEEKDAYS_OF_MONTH -> {
        ArrayNode patterns = node.putArray("patterns");
        for (NthWeekday p : day.nthWeekdays()) {
          ObjectNode pattern = patterns.addObject();
          pattern.put("ordinal", p.ordinal().toString());
          pattern.put("weekday", lower(p.weekday()));
        }
      }
    }
    return node;
  }

  private ObjectNode encodeWeek(WeekConstraint week) {
    ObjectNode node = tagged(week.kind().tag());
    switch (week.kind()) {
      case EVERY_WEEK -> {}
      case EVERY_N_WEEKS -> node.put("interval", week.interval());
      case WEEKS_OF_MONTH_FROM_START, WEEKS_OF_MONTH_FROM_END -> {
        ArrayNode offsets = node.putArray("offsets");
        week.offsets().forEach(o -> offsets.add(o.intValue()));
      }
    }
    return node;
  }

  private ObjectNode encodeMonth(MonthConstraint month) {
    ObjectNode node = tagged(month.kind().tag());
    switch (month.kind()) {
      case EVERY_MONTH -> {}
      case EVERY_N_MONTHS -> node.put("interval", month.interval());
      case MONTHS -> {
        ArrayNode months = node.putArray("months");
        month.months().forEach(m -> months.add(lower(m)));
      }
    }
    return node;
  }

  private ObjectNode encodeYear(YearConstraint year) {
    ObjectNode node = tagged(year.kind().tag());
    switch (year.kind()) {
      case EVERY_YEAR -> {}
      case EVERY_N_YEARS -> node.put("interval", year.interval());
      case YEARS -> {
        ArrayNode years = node.putArray("years");
        year.years().forEach(y -> years.add(y.intValue()));
      }
    }
    return node;
  }

  private ObjectNode encodeSpecial(SpecialPattern pattern) {
    ObjectNode node = tagged(pattern.kind().tag());
    switch (pattern.kind()) {
      case UNIQUE -> node.put("date", pattern.date().toString());
      case CUSTOM -> {
        ArrayNode dates = node.putArray("dates");
        pattern.dates().forEach(d -> dates.add(d.toString()));
      }
    }
    return node;
  }

  private ObjectNode tagged(String type) {
    ObjectNode node = mapper.createObjectNode();
    node.put("type", type);
    return node;
  }

  // Decoding

  private static PeriodicityData decode(JsonNode root) throws PeriodicityException {
    if (root == null || !root.isObject()) {
      throw invalid("periodicity", root, "must be a JSON object");
    }

    String unitText = requiredText(root, "rep_unit");
    RepetitionUnit repUnit =
        RepetitionUnit.parse(unitText)
            .orElseThrow(() -> invalid("rep_unit", unitText, "unknown repetition unit"));
    Integer repPerUnit = optionalInt(root, "rep_per_unit");

    PeriodicityConstraints constraints = PeriodicityConstraints.none();
    JsonNode c = present(root, "constraints");
    if (c != null) {
      if (!c.isObject()) {
        throw invalid("constraints", c, "must be a JSON object");
      }
      JsonNode day = present(c, "day");
      if (day != null) {
        constraints = constraints.withDay(decodeDay(day));
      }
      JsonNode week = present(c, "week");
      if (week != null) {
        constraints = constraints.withWeek(decodeWeek(week));
      }
      JsonNode month = present(c, "month");
      if (month != null) {
        constraints = constraints.withMonth(decodeMonth(month));
      }
      JsonNode year = present(c, "year");
      if (year != null) {
        constraints = constraints.withYear(decodeYear(year));
      }
    }

    Timeframe timeframe = null;
    JsonNode tf = present(root, "timeframe");
    if (tf != null) {
      if (!tf.isObject()) {
        throw invalid("timeframe", tf, "must be a JSON object");
      }
      timeframe = new Timeframe(optionalDate(tf, "start"), optionalDate(tf, "end"));
    }

    DayOfWeek weekStart = PeriodicityData.DEFAULT_WEEK_START;
    if (present(root, "week_start") != null) {
      weekStart = parseEnum(DayOfWeek.class, "week_start", requiredText(root, "week_start"));
    }
    Month yearStart = PeriodicityData.DEFAULT_YEAR_START;
    if (present(root, "year_start") != null) {
      yearStart = parseEnum(Month.class, "year_start", requiredText(root, "year_start"));
    }

    SpecialPattern special = null;
    JsonNode sp = present(root, "special_pattern");
    if (sp != null) {
      special = decodeSpecial(sp);
    }

    LocalDate anchor = optionalDate(root, "anchor");

    return new PeriodicityData(
        repUnit, repPerUnit, constraints, timeframe, weekStart, yearStart, special, anchor);
  }

  private static DayConstraint decodeDay(JsonNode node) throws PeriodicityException {
    String type = type(node, "constraints.day");
    if (type.equals(DayConstraint.Kind.EVERY_DAY.tag())) {
      return DayConstraint.everyDay();
    }
    if (type.equals(DayConstraint.Kind.EVERY_N_DAYS.tag())) {
      return DayConstraint.everyNDays(requiredInt(node, "interval"));
    }
    if (type.equals(DayConstraint.Kind.DAYS_OF_WEEK.tag())) {
      List<DayOfWeek> weekdays = new ArrayList<>();
      for (JsonNode d : requiredArray(node, "weekdays")) {
        weekdays.add(parseEnum(DayOfWeek.class, "weekdays", text(d, "weekdays")));
      }
      return DayConstraint.daysOfWeek(weekdays);
    }
    if (type.equals(DayConstraint.Kind.DAYS_OF_MONTH_FROM_START.tag())) {
      return DayConstraint.daysOfMonthFromStart(intList(node, "offsets"));
    }
    if (type.equals(DayConstraint.Kind.DAYS_OF_MONTH_FROM_END.tag())) {
      return DayConstraint.daysOfMonthFromEnd(intList(node, "offsets"));
    }
    if (type.equals(DayConstraint.Kind.NTH_WEEKDAYS_OF_MONTH.tag())) {
      List<NthWeekday> patterns = new ArrayList<>();
      for (JsonNode p : requiredArray(node, "patterns")) {
        if (!p.isObject()) {
          throw invalid("patterns", p, "must be a JSON object");
        }
        String ordinalText = requiredText(p, "ordinal");
        OrdinalPosition ordinal =
            OrdinalPosition.parse(ordinalText)
                .orElseThrow(() -> invalid("ordinal", ordinalText, "unknown ordinal"));
        DayOfWeek weekday =
            parseEnum(DayOfWeek.class, "weekday", requiredText(p, "weekday"));
        patterns.add(new NthWeekday(ordinal, weekday));
      }
      return DayConstraint.nthWeekdaysOfMonth(patterns);
    }
    throw invalid("constraints.day.type", type, "unknown day constraint");
  }

  private static WeekConstraint decodeWeek(JsonNode node) throws PeriodicityException {
    String type = type(node, "constraints.week");
    if (type.equals(WeekConstraint.Kind.EVERY_WEEK.tag())) {
      return WeekConstraint.everyWeek();
    }
    if (type.equals(WeekConstraint.Kind.EVERY_N_WEEKS.tag())) {
      return WeekConstraint.everyNWeeks(requiredInt(node, "interval"));
    }
    if (type.equals(WeekConstraint.Kind.WEEKS_OF_MONTH_FROM_START.tag())) {
      return WeekConstraint.weeksOfMonthFromStart(intList(node, "offsets"));
    }
    if (type.equals(WeekConstraint.Kind.WEEKS_OF_MONTH_FROM_END.tag())) {
      return WeekConstraint.weeksOfMonthFromEnd(intList(node, "offsets"));
    }
    throw invalid("constraints.week.type", type, "unknown week constraint");
  }

  private static MonthConstraint decodeMonth(JsonNode node) throws PeriodicityException {
    String type = type(node, "constraints.month");
    if (type.equals(MonthConstraint.Kind.EVERY_MONTH.tag())) {
      return MonthConstraint.everyMonth();
    }
    if (type.equals(MonthConstraint.Kind.EVERY_N_MONTHS.tag())) {
      return MonthConstraint.everyNMonths(requiredInt(node, "interval"));
    }
    if (type.equals(MonthConstraint.Kind.MONTHS.tag())) {
      List<Month> months = new ArrayList<>();
      for (JsonNode m : requiredArray(node, "months")) {
        months.add(parseEnum(Month.class, "months", text(m, "months")));
      }
      return MonthConstraint.months(months);
    }
    throw invalid("constraints.month.type", type, "unknown month constraint");
  }

  private static YearConstraint decodeYear(JsonNode node) throws PeriodicityException {
    String type = type(node, "constraints.year");
    if (type.equals(YearConstraint.Kind.EVERY_YEAR.tag())) {
      return YearConstraint.everyYear();
    }
    if (type.equals(YearConstraint.Kind.EVERY_N_YEARS.tag())) {
      return YearConstraint.everyNYears(requiredInt(node, "interval"));
    }
    if (type.equals(YearConstraint.Kind.YEARS.tag())) {
      return YearConstraint.years(intList(node, "years"));
    }
    throw invalid("constraints.year.type", type, "unknown year constraint");
  }

  private static SpecialPattern decodeSpecial(JsonNode node) throws PeriodicityException {
    String type = type(node, "special_pattern");
    if (type.equals(SpecialPattern.Kind.UNIQUE.tag())) {
      return SpecialPattern.unique(requiredDate(node, "date"));
    }
    if (type.equals(SpecialPattern.Kind.CUSTOM.tag())) {
      List<LocalDate> dates = new ArrayList<>();
      for (JsonNode d : requiredArray(node, "dates")) {
        dates.add(parseDate("dates", text(d, "dates")));
      }
      return SpecialPattern.custom(dates);
    }
    throw invalid("special_pattern.type", type, "unknown special pattern");
  }

  // Field access

  private static JsonNode present(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value;
  }

  private static String type(JsonNode node, String field) throws PeriodicityException {
    if (!node.isObject()) {
      throw invalid(field, node, "must be a JSON object");
    }
    return requiredText(node, "type");
  }

  private static String requiredText(JsonNode node, String field) throws PeriodicityException {
    JsonNode value = present(node, field);
    if (value == null) {
      throw missing(field);
    }
    return text(value, field);
  }

  private static String text(JsonNode value, String field) throws PeriodicityException {
    if (!value.isTextual()) {
      throw invalid(field, value, "must be a string");
    }
    return value.asText();
  }

  private static int requiredInt(JsonNode node, String field) throws PeriodicityException {
    Integer value = optionalInt(node, field);
    if (value == null) {
      throw missing(field);
    }
    return value;
  }

  private static Integer optionalInt(JsonNode node, String field) throws PeriodicityException {
    JsonNode value = present(node, field);
    if (value == null) {
      return null;
    }
    if (!value.isInt()) {
      throw invalid(field, value, "must be an integer");
    }
    return value.intValue();
  }

  private static JsonNode requiredArray(JsonNode node, String field) throws PeriodicityException {
    JsonNode value = present(node, field);
    if (value == null) {
      throw missing(field);
    }
    if (!value.isArray()) {
      throw invalid(field, value, "must be an array");
    }
    return value;
  }

  private static List<Integer> intList(JsonNode node, String field) throws PeriodicityException {
    List<Integer> values = new ArrayList<>();
    for (JsonNode v : requiredArray(node, field)) {
      if (!v.isInt()) {
        throw invalid(field, v, "must contain only integers");
      }
      values.add(v.intValue());
    }
    return values;
  }

  private static LocalDate requiredDate(JsonNode node, String field) throws PeriodicityException {
    return parseDate(field, requiredText(node, field));
  }

  private static LocalDate optionalDate(JsonNode node, String field) throws PeriodicityException {
    return present(node, field) == null ? null : requiredDate(node, field);
  }

  private static LocalDate parseDate(String field, String text) throws PeriodicityException {
    try {
      return LocalDate.parse(text);
    } catch (DateTimeException e) {
      throw new PeriodicityException(
          new InvalidValue(field, text, "must be an ISO-8601 date (yyyy-MM-dd)"), e);
    }
  }

  private static <E extends Enum<E>> E parseEnum(Class<E> type, String field, String text)
      throws PeriodicityException {
    try {
      return Enum.valueOf(type, text.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new PeriodicityException(
          new InvalidValue(field, text, "unknown " + type.getSimpleName()), e);
    }
  }

  private static PeriodicityException missing(String field) {
    return new PeriodicityException(new MissingRequired(field, "field is absent"));
  }

  private static PeriodicityException invalid(String field, Object value, String reason) {
    return new PeriodicityException(new InvalidValue(field, String.valueOf(value), reason));
  }

  private static String lower(Enum<?> value) {
    return value.name().toLowerCase(Locale.ROOT);
  }

  private static String abbreviate(String json) {
    return json.length() <= 40 ? json : json.substring(0, 40) + "...";
  }
}
