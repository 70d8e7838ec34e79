package org.csits.mig.server.plugin.ledger;

import org.csits.mig.manager.plugin.Loader;
import org.csits.mig.server.dto.JobRunContext;
import org.csits.mig.server.dto.LoadStepConfig;
import org.csits.mig.server.plugin.LoaderFactory;
import org.springframework.stereotype.Component;

@Component
public class LedgerLoaderFactory implements LoaderFactory {

    @Override
    public String getType() {
        return "ledger";
    }

    @Override
    public Loader create(LoadStepConfig step, JobRunContext context) {
        return new LedgerLoader(step, context.getJobName());
    }
}
