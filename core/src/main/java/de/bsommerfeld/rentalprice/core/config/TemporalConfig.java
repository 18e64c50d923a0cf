package de.bsommerfeld.rentalprice.core.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.MonthDay;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Calendar parameters for the temporal engine. Holidays are fixed
 * {@code MM-dd} dates that recur every year.
 */
public class TemporalConfig {

    static final DateTimeFormatter HOLIDAY_FORMAT = DateTimeFormatter.ofPattern("MM-dd");

    @JsonProperty("holidays")
    private List<String> holidayNames = new ArrayList<>(List.of(
            "01-01", "04-21", "05-01", "09-07", "10-12", "11-02", "11-15", "12-25"));

    @JsonProperty("holiday-window-days")
    private int holidayWindowDays = 1;

    public List<String> getHolidayNames() {
        return holidayNames;
    }

    public void setHolidayNames(List<String> holidayNames) {
        this.holidayNames = holidayNames;
    }

    /**
     * @throws java.time.format.DateTimeParseException for entries that are
     *                                                 not {@code MM-dd}
     */
    @JsonIgnore
    public List<MonthDay> getHolidays() {
        return holidayNames.stream()
                .map(s -> MonthDay.parse(s.trim(), HOLIDAY_FORMAT))
                .collect(Collectors.toList());
    }

    public int getHolidayWindowDays() {
        return holidayWindowDays;
    }

    public void setHolidayWindowDays(int holidayWindowDays) {
        this.holidayWindowDays = holidayWindowDays;
    }
}
