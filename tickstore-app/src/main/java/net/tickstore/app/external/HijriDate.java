package net.tickstore.app.external;

public record HijriDate(int day, int month, String monthName, int year) {
    @Override
    public String toString() {
        return day + " " + monthName + " (" + month + ") " + year;
    }
}
