package com.example.automatacurve;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.File;
import java.io.IOException;
import java.util.*;

/**
 * Serializes computed point sets to JSON for an external plotter.
 */
public class PointSetSerializer {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class PointSetEntry {
        @JsonProperty("x")
        private List<Double> x;

        @JsonProperty("y")
        private List<Double> y;

        @JsonProperty("xlim")
        private double[] xlim;

        @JsonProperty("ylim")
        private double[] ylim;

        @JsonProperty("is_curve")
        private boolean curve;

        @JsonProperty("color")
        private String color;

        public PointSetEntry() {}

        public PointSetEntry(PointSet set) {
            this.x = set.getX();
            this.y = set.getY();
            this.xlim = bounds(set.getXlim());
            this.ylim = bounds(set.getYlim());
            this.curve = set.isCurve();
            this.color = set.getColor();
        }

        public List<Double> getX() { return x; }
        public void setX(List<Double> x) { this.x = x; }

        public List<Double> getY() { return y; }
        public void setY(List<Double> y) { this.y = y; }

        public double[] getXlim() { return xlim; }
        public void setXlim(double[] xlim) { this.xlim = xlim; }

        public double[] getYlim() { return ylim; }
        public void setYlim(double[] ylim) { this.ylim = ylim; }

        public boolean isCurve() { return curve; }
        public void setCurve(boolean curve) { this.curve = curve; }

        public String getColor() { return color; }
        public void setColor(String color) { this.color = color; }

        private static double[] bounds(PointSet.Range range) {
            return range == null ? null : new double[] {range.getMin(), range.getMax()};
        }
    }

    public static class PlotJson {
        @JsonProperty("_comment")
        private String comment;

        @JsonProperty("point_sets")
        private List<PointSetEntry> pointSets;

        public PlotJson() {}

        public PlotJson(String comment, List<PointSetEntry> pointSets) {
            this.comment = comment;
            this.pointSets = pointSets;
        }

        public String getComment() { return comment; }
        public void setComment(String comment) { this.comment = comment; }

        public List<PointSetEntry> getPointSets() { return pointSets; }
        public void setPointSets(List<PointSetEntry> pointSets) { this.pointSets = pointSets; }
    }

    public static PlotJson toJson(List<PointSet> sets, String description) {
        List<PointSetEntry> entries = new ArrayList<>();
        for (PointSet set : sets) {
            entries.add(new PointSetEntry(set));
        }
        return new PlotJson("Points computed for " + description, entries);
    }

    /**
     * Serializes point sets to JSON and saves to file
     */
    public static void serializeToJson(List<PointSet> sets, String description, String filename) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.writeValue(new File(filename), toJson(sets, description));

        int points = 0;
        for (PointSet set : sets) {
            points += set.size();
        }
        System.out.println("Wrote " + sets.size() + " point set(s), " + points + " points to " + filename);
    }
}
