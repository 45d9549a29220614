package io.nextrun.core.schedule;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import io.nextrun.core.EngineConfig;
import io.nextrun.core.description.DescriptionGenerator;
import io.nextrun.core.description.MessageCatalog;

public class ScheduleModule
        implements Module
{
    private final EngineConfig engineConfig;

    public ScheduleModule()
    {
        this(EngineConfig.defaults());
    }

    public ScheduleModule(EngineConfig engineConfig)
    {
        this.engineConfig = engineConfig;
    }

    @Override
    public void configure(Binder binder)
    {
        binder.bind(EngineConfig.class).toInstance(engineConfig);

        binder.bind(ConfigurationValidator.class).in(Scopes.SINGLETON);
        binder.bind(HourExpander.class).in(Scopes.SINGLETON);
        binder.bind(OnceDateCalculator.class).in(Scopes.SINGLETON);
        binder.bind(DailyDateCalculator.class).in(Scopes.SINGLETON);
        binder.bind(WeeklyDateCalculator.class).in(Scopes.SINGLETON);
        binder.bind(MonthlyOrdinalDateCalculator.class).in(Scopes.SINGLETON);
        binder.bind(MonthlySpecificDayDateCalculator.class).in(Scopes.SINGLETON);
        binder.bind(ExecutionTimeGenerator.class).in(Scopes.SINGLETON);

        binder.bind(MessageCatalog.class).in(Scopes.SINGLETON);
        binder.bind(DescriptionGenerator.class).in(Scopes.SINGLETON);

        binder.bind(OnceScheduleType.class).in(Scopes.SINGLETON);
        binder.bind(RecurringScheduleType.class).in(Scopes.SINGLETON);
        binder.bind(ScheduleTypeFactory.class).in(Scopes.SINGLETON);
        binder.bind(ScheduleService.class).in(Scopes.SINGLETON);
    }
}
