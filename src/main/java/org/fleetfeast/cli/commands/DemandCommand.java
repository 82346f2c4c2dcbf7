package org.fleetfeast.cli.commands;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

import org.fleetfeast.cli.CommandLineInterface;
import org.fleetfeast.cli.config.ConfigLoader;
import org.fleetfeast.runtime.demand.ZoneDemandModel;
import org.fleetfeast.runtime.model.WorldState;
import org.fleetfeast.runtime.model.Zone;
import org.fleetfeast.runtime.model.ZoneProfile;
import org.fleetfeast.runtime.worldgen.WorldFactory;

import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Prints the hourly demand curve of each configured zone.
 */
@Command(
    name = "demand",
    description = "Print the average demand per hour of the day for each zone"
)
public class DemandCommand implements Callable<Integer> {

    private static final int BAR_WIDTH = 40;

    @Option(
        names = {"-z", "--zone"},
        description = "Only print this zone (repeatable)"
    )
    private List<String> zones = new ArrayList<>();

    @Option(
        names = {"--day"},
        description = "Day number to sample, affects noise only (default: ${DEFAULT-VALUE})",
        defaultValue = "0"
    )
    private long day;

    @Option(
        names = {"--base"},
        description = "Print the noise-free signal"
    )
    private boolean baseOnly;

    @Option(
        names = {"--csv"},
        description = "Print comma-separated values instead of bars"
    )
    private boolean csv;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        final WorldState world;
        final ZoneDemandModel model;
        try {
            Config worldConfig = parent.getConfig().getConfig(ConfigLoader.ROOT + ".world");
            world = WorldFactory.create(worldConfig);
            model = WorldFactory.demandModel(worldConfig);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        List<Zone> selected = new ArrayList<>();
        for (String id : zones) {
            if (world.zone(id).isEmpty()) {
                err.println("Error: unknown zone '" + id + "'");
                return 1;
            }
            selected.add(world.zone(id).get());
        }
        if (selected.isEmpty()) {
            selected.addAll(world.zones());
        }

        int hours = model.getDayLength() / 60;
        long dayStart = day * model.getDayLength();
        if (csv) {
            out.println("zone,hour,demand");
        }
        for (Zone zone : selected) {
            double[] curve = hourlyCurve(model, zone.getProfile(), dayStart, hours);
            if (csv) {
                for (int hour = 0; hour < hours; hour++) {
                    out.printf(Locale.ROOT, "%s,%d,%.3f%n", zone.getId(), hour, curve[hour]);
                }
            } else {
                printBars(out, zone.getProfile(), curve);
            }
        }
        out.flush();
        return 0;
    }

    private double[] hourlyCurve(ZoneDemandModel model, ZoneProfile profile, long dayStart, int hours) {
        double[] curve = new double[hours];
        for (int hour = 0; hour < hours; hour++) {
            double sum = 0.0;
            for (int minute = 0; minute < 60; minute++) {
                int minuteOfDay = hour * 60 + minute;
                sum += baseOnly
                        ? model.baseSignal(profile, minuteOfDay)
                        : model.demandAt(profile, dayStart + minuteOfDay);
            }
            curve[hour] = sum / 60.0;
        }
        return curve;
    }

    private void printBars(PrintWriter out, ZoneProfile profile, double[] curve) {
        out.printf(Locale.ROOT, "%n%s (max %.1f orders/min)%n", profile.id(), profile.maxOrders());
        double scale = profile.maxOrders() > 0 ? BAR_WIDTH / profile.maxOrders() : 0.0;
        for (int hour = 0; hour < curve.length; hour++) {
            int width = (int) Math.round(Math.min(BAR_WIDTH, curve[hour] * scale));
            out.printf(Locale.ROOT, "  %02d:00 %6.2f %s%n", hour, curve[hour], "#".repeat(width));
        }
    }
}
