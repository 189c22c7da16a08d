package com.nuti.fleet.sim;

import com.nuti.fleet.model.EdgeCatalog;
import com.nuti.fleet.testutil.GraphFixtures;
import com.nuti.fleet.testutil.ScriptedRandom;
import com.nuti.fleet.testutil.ScriptedRouteChannel;
import org.junit.jupiter.api.Test;

import java.io.EOFException;
import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SimulationResultTest {

    private static final EdgeCatalog LINE = GraphFixtures.line(3, 1000.0, 10.0);

    private static CarAgent car(int id, ScriptedRouteChannel channel) throws IOException {
        CarAgent car = new CarAgent(id, LINE, new LockingJamModel(JamSettings.disabled()),
                DrivingSettings.defaults().withReportEvery(1), new ScriptedRandom(0.5, 0, 2));
        car.connect(carId -> channel);
        return car;
    }

    @Test
    void of_retiredCars_countOnlyAsFailed() throws IOException {
        CarAgent driving = car(0, new ScriptedRouteChannel().thenRoute(0, 2));
        CarAgent waiting = car(1, new ScriptedRouteChannel().thenNoRoute());
        CarAgent retiredWhileDriving = car(2, new ScriptedRouteChannel().thenRoute(0, 2)
                .failReportsWith(new EOFException("Server closed connection")));
        CarAgent retiredWhileWaiting = car(3, new ScriptedRouteChannel().thenFail(new EOFException("Server closed connection")));
        List<CarAgent> cars = List.of(driving, waiting, retiredWhileDriving, retiredWhileWaiting);

        assertTrue(driving.advance(0));
        assertTrue(waiting.advance(0));
        assertFalse(retiredWhileDriving.advance(0));
        assertFalse(retiredWhileWaiting.advance(0));

        SimulationResult r = SimulationResult.of(RunMode.SEQUENTIAL, 1, 1, 0L, cars);

        assertEquals(4, r.cars());
        assertEquals(2, r.failed());
        assertEquals(1, r.driving());
        assertEquals(1, r.waiting());
        assertEquals(0, r.arrived());
        assertEquals(4, r.agents().size());
    }
}
