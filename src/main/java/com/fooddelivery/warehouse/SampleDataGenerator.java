package com.fooddelivery.warehouse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Random;

/**
 * Utility class to generate a sample food order feed for exercising the pipeline.
 * The feed carries the defects the pipeline has to cope with: exact duplicates, blank text
 * fields, missing or unparseable dates and malformed numbers.
 */
public class SampleDataGenerator {

    private static final Logger logger = LoggerFactory.getLogger(SampleDataGenerator.class);

    static final String HEADER = "State,City,Order_Date,Restaurant_Name,Location,Category,Dish_Name,Price_INR,Rating,Rating_Count";

    private static final String[][] CITIES = {
        {"Karnataka", "Bengaluru", "Koramangala"},
        {"Karnataka", "Bengaluru", "Indiranagar"},
        {"Karnataka", "Mysuru", "Vijayanagar"},
        {"Maharashtra", "Mumbai", "Andheri"},
        {"Maharashtra", "Mumbai", "Bandra"},
        {"Maharashtra", "Pune", "Kothrud"},
        {"Delhi", "New Delhi", "Connaught Place"},
        {"Delhi", "New Delhi", "Saket"},
        {"Tamil Nadu", "Chennai", "T Nagar"},
        {"Telangana", "Hyderabad", "Gachibowli"},
        {"West Bengal", "Kolkata", "Salt Lake"}
    };

    private static final String[] RESTAURANTS = {
        "Domino's Pizza", "KFC", "Burger King", "Behrouz Biryani", "Meghana Foods", "Haldiram's",
        "Faasos", "Wow! Momo", "McDonald's", "Paradise Biryani", "Chai Point", "Theobroma"
    };

    private static final String[][] DISHES = {
        {"Pizza", "Margherita"}, {"Pizza", "Farmhouse"}, {"Pizza", "Peppy Paneer"},
        {"Biryani", "Chicken Dum Biryani"}, {"Biryani", "Veg Biryani"}, {"Biryani", "Mutton Biryani"},
        {"Burgers", "Whopper"}, {"Burgers", "McAloo Tikki"}, {"Chinese", "Veg Momos"},
        {"Chinese", "Hakka Noodles"}, {"Desserts", "Brownie"}, {"Desserts", "Gulab Jamun"},
        {"Beverages", "Masala Chai"}, {"Beverages", "Cold Coffee"}, {"North Indian", "Paneer Butter Masala"}
    };

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_LOCAL_DATE;
    private static final DateTimeFormatter DAY_FIRST = DateTimeFormatter.ofPattern("dd-MM-yyyy");

    public static void main(String[] args) {
        int numRecords = args.length > 0 ? Integer.parseInt(args[0]) : 100000;
        String outputPath = args.length > 1 ? args[1] : "data/food_orders.csv";

        logger.info("Generating {} sample orders...", numRecords);
        generateSampleData(numRecords, outputPath);
        logger.info("Sample data generated at: {}", outputPath);
    }

    /**
     * Generate a CSV feed with numRecords lines; the same seed always yields the same file.
     */
    public static void generateSampleData(int numRecords, String outputPath) {
        Random random = new Random(42);
        LocalDate start = LocalDate.of(2025, 1, 1);
        String previous = null;

        try (FileWriter writer = new FileWriter(outputPath)) {
            writer.append(HEADER).append('\n');

            for (int i = 1; i <= numRecords; i++) {
                // 3% exact duplicates of the previous line
                if (previous != null && random.nextDouble() < 0.03) {
                    writer.append(previous).append('\n');
                    continue;
                }

                String[] place = CITIES[random.nextInt(CITIES.length)];
                String restaurant = RESTAURANTS[random.nextInt(RESTAURANTS.length)];
                String[] dish = DISHES[random.nextInt(DISHES.length)];

                String orderDate;
                double dateRoll = random.nextDouble();
                LocalDate date = start.plusDays(random.nextInt(181));
                if (dateRoll < 0.01) {
                    orderDate = "";
                } else if (dateRoll < 0.02) {
                    orderDate = "not-a-date";
                } else if (dateRoll < 0.10) {
                    orderDate = date.format(DAY_FIRST);
                } else {
                    orderDate = date.format(ISO);
                }

                String location = random.nextDouble() < 0.01 ? " " : place[2];

                String price;
                if (random.nextDouble() < 0.01) {
                    price = "n/a";
                } else {
                    price = String.format(Locale.ROOT, "%.2f", 49 + random.nextDouble() * 750);
                }

                String rating = String.format(Locale.ROOT, "%.1f", 2.5 + random.nextInt(26) / 10.0);
                String ratingCount = String.valueOf(random.nextInt(5000));

                String line = String.join(",",
                    place[0],
                    place[1],
                    orderDate,
                    "\"" + restaurant + "\"",
                    location,
                    dish[0],
                    "\"" + dish[1] + "\"",
                    price,
                    rating,
                    ratingCount
                );
                writer.append(line).append('\n');
                previous = line;

                if (i % 10000 == 0) {
                    logger.debug("Generated {} records...", i);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Error generating sample data at " + outputPath, e);
        }
    }
}
